package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;

/**
 * One completed relay between two characters
 */
public final class CommunicationRecord {
    private final String from;
    private final String to;
    private final RelationshipType relationship;
    private final double truthfulness;
    private final String relayText;
    private final String reactionText;

    public CommunicationRecord(String from, String to, RelationshipType relationship, double truthfulness,
                               String relayText, String reactionText) {
        this.from = from;
        this.to = to;
        this.relationship = relationship;
        this.truthfulness = truthfulness;
        this.relayText = relayText;
        this.reactionText = reactionText;
    }

    public String getFrom() { return from; }
    public String getTo() { return to; }
    public RelationshipType getRelationship() { return relationship; }
    public double getTruthfulness() { return truthfulness; }
    public String getRelayText() { return relayText; }
    public String getReactionText() { return reactionText; }
}
