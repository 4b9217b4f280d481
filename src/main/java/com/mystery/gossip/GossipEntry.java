package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;

/**
 * Something a character heard from another character, as it was retold
 */
public final class GossipEntry {
    private final String source;
    private final String text;
    private final RelationshipType relationship;

    public GossipEntry(String source, String text, RelationshipType relationship) {
        this.source = source;
        this.text = text;
        this.relationship = relationship;
    }

    public String getSource() { return source; }
    public String getText() { return text; }
    public RelationshipType getRelationship() { return relationship; }
}
