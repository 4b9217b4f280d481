package com.mystery.case_model;

/**
 * Closed set of relationship labels between two characters
 */
public enum RelationshipType {
    CLOSE_FRIEND("Close Friend"),
    ROMANTIC_PARTNER("Romantic Partner"),
    BUSINESS_PARTNER("Business Partner"),
    RIVAL("Rival"),
    ENEMY("Enemy"),
    ACQUAINTANCE("Acquaintance"),
    FAMILY_MEMBER("Family Member");

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHostile() {
        return this == RIVAL || this == ENEMY;
    }

    public boolean isIntimate() {
        return this == CLOSE_FRIEND || this == ROMANTIC_PARTNER;
    }

    /**
     * Case-insensitive lookup by display label; underscores are read as spaces.
     *
     * @throws IllegalArgumentException for a label outside the set
     */
    public static RelationshipType fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Relationship label is missing");
        }
        String normalized = label.trim().replace('_', ' ');
        for (RelationshipType type : RelationshipType.values()) {
            if (type.label.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
