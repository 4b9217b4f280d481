package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;

/**
 * A character selected to hear about an interrogation
 */
public final class GossipRecipient {
    private final String name;
    private final RelationshipType relationship;
    private final double truthfulness;

    public GossipRecipient(String name, RelationshipType relationship, double truthfulness) {
        this.name = name;
        this.relationship = relationship;
        this.truthfulness = truthfulness;
    }

    public String getName() { return name; }
    public RelationshipType getRelationship() { return relationship; }
    public double getTruthfulness() { return truthfulness; }

    @Override
    public String toString() {
        return name + " (" + relationship.getLabel() + ", " + truthfulness + ")";
    }
}
