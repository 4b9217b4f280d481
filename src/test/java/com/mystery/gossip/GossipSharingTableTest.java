package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.Trait;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GossipSharingTableTest {

    @Test
    public void sharingRuleDependsOnlyOnRelationship() {
        assertEquals(new GossipSharingTable.SharingRule(true, 0.15), GossipSharingTable.ruleFor(RelationshipType.ENEMY));
        assertEquals(GossipSharingTable.ruleFor(RelationshipType.ENEMY), GossipSharingTable.ruleFor(RelationshipType.ENEMY));
        assertEquals(new GossipSharingTable.SharingRule(true, 0.95), GossipSharingTable.ruleFor(RelationshipType.CLOSE_FRIEND));
        assertEquals(new GossipSharingTable.SharingRule(true, 0.98), GossipSharingTable.ruleFor(RelationshipType.ROMANTIC_PARTNER));
        assertEquals(new GossipSharingTable.SharingRule(true, 0.35), GossipSharingTable.ruleFor(RelationshipType.RIVAL));
    }

    @Test
    public void neutralRelationshipsDoNotShare() {
        assertFalse(GossipSharingTable.ruleFor(RelationshipType.ACQUAINTANCE).shouldShare());
        assertFalse(GossipSharingTable.ruleFor(RelationshipType.BUSINESS_PARTNER).shouldShare());
        assertFalse(GossipSharingTable.ruleFor(RelationshipType.FAMILY_MEMBER).shouldShare());
        assertTrue(GossipSharingTable.effectsFor(RelationshipType.FAMILY_MEMBER).isEmpty());
    }

    @Test
    public void effectsOnTheListener() {
        assertEquals(Map.of(Trait.ANXIETY, 0.5, Trait.TRUST, -0.5), GossipSharingTable.effectsFor(RelationshipType.ENEMY));
        assertEquals(Map.of(Trait.MOODINESS, 0.3, Trait.TRUST, -0.3), GossipSharingTable.effectsFor(RelationshipType.RIVAL));
        assertEquals(Map.of(Trait.TRUST, 0.7), GossipSharingTable.effectsFor(RelationshipType.ROMANTIC_PARTNER));
        assertEquals(Map.of(Trait.TRUST, 0.5), GossipSharingTable.effectsFor(RelationshipType.CLOSE_FRIEND));
    }
}
