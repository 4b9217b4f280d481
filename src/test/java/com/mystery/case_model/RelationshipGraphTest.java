package com.mystery.case_model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RelationshipGraphTest {

    private static final List<String> NAMES = List.of("Nick", "Sarah", "James");

    private static Map<String, String> pairs(String... keysAndLabels) {
        Map<String, String> pairs = new LinkedHashMap<>();
        for (int i = 0; i < keysAndLabels.length; i += 2) {
            pairs.put(keysAndLabels[i], keysAndLabels[i + 1]);
        }
        return pairs;
    }

    @Test
    public void lookupIsSymmetricAndAcceptsEitherKeyOrder() {
        RelationshipGraph graph = RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Sarah", "Close Friend", "James_Nick", "rival", "Sarah_James", "romantic_partner"));

        assertEquals(RelationshipType.RIVAL, graph.between("Nick", "James"));
        assertEquals(RelationshipType.RIVAL, graph.between("James", "Nick"));
        assertEquals(RelationshipType.ROMANTIC_PARTNER, graph.between("Sarah", "James"));
        assertEquals(3, graph.size());
    }

    @Test
    public void relationsAreListedInRosterOrder() {
        RelationshipGraph graph = RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Sarah", "Close Friend", "Nick_James", "Enemy", "Sarah_James", "Acquaintance"));

        Map<String, RelationshipType> relations = graph.relationsOf("James");

        assertEquals(List.of("Nick", "Sarah"), List.copyOf(relations.keySet()));
        assertEquals(List.of("James"), graph.namesWith("Nick", RelationshipType.ENEMY));
        assertTrue(graph.hasAny(RelationshipType.CLOSE_FRIEND));
        assertFalse(graph.hasAny(RelationshipType.FAMILY_MEMBER));
        assertEquals(List.of("Nick_Sarah", "Nick_James", "Sarah_James"), List.copyOf(graph.asPairs().keySet()));
    }

    @Test
    public void conflictingLabelsForOnePairAreRejected() {
        assertThrows(CaseGenerationException.class, () -> RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Sarah", "Close Friend", "Sarah_Nick", "Enemy", "Nick_James", "Enemy", "Sarah_James", "Enemy")));
    }

    @Test
    public void malformedOrSelfPairsAreRejected() {
        assertThrows(CaseGenerationException.class, () -> RelationshipGraph.fromPairs(NAMES,
            pairs("Nick-Sarah", "Close Friend")));
        assertThrows(CaseGenerationException.class, () -> RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Nick", "Close Friend")));
        assertThrows(CaseGenerationException.class, () -> RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Butler", "Close Friend")));
    }

    @Test
    public void unknownPairLookupFails() {
        RelationshipGraph graph = RelationshipGraph.fromPairs(NAMES,
            pairs("Nick_Sarah", "Close Friend", "Nick_James", "Enemy", "Sarah_James", "Acquaintance"));

        assertThrows(IllegalArgumentException.class, () -> graph.between("Nick", "Nick"));
        assertThrows(IllegalArgumentException.class, () -> graph.between("Nick", "Lisa"));
    }
}
