package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.Trait;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed rules for who passes an interrogation on, how faithfully, and what hearing it does to the listener.
 * Pure: the same label always gives the same answer.
 */
public final class GossipSharingTable {

    private static final SharingRule NO_SHARING = new SharingRule(false, 0.0);

    private GossipSharingTable() {
    }

    public static SharingRule ruleFor(RelationshipType type) {
        if (type == null) {
            return NO_SHARING;
        }
        switch (type) {
            case CLOSE_FRIEND:
                return new SharingRule(true, 0.95);
            case ROMANTIC_PARTNER:
                return new SharingRule(true, 0.98);
            case ENEMY:
                return new SharingRule(true, 0.15);
            case RIVAL:
                return new SharingRule(true, 0.35);
            default:
                return NO_SHARING;
        }
    }

    /**
     * Fractional trait shifts applied to the listener
     */
    public static Map<Trait, Double> effectsFor(RelationshipType type) {
        Map<Trait, Double> effects = new EnumMap<>(Trait.class);
        if (type == null) {
            return effects;
        }
        switch (type) {
            case CLOSE_FRIEND:
                effects.put(Trait.TRUST, 0.5);
                break;
            case ROMANTIC_PARTNER:
                effects.put(Trait.TRUST, 0.7);
                break;
            case ENEMY:
                effects.put(Trait.ANXIETY, 0.5);
                effects.put(Trait.TRUST, -0.5);
                break;
            case RIVAL:
                effects.put(Trait.MOODINESS, 0.3);
                effects.put(Trait.TRUST, -0.3);
                break;
            default:
                break;
        }
        return Collections.unmodifiableMap(effects);
    }

    public static final class SharingRule {
        private final boolean shouldShare;
        private final double truthfulness;

        public SharingRule(boolean shouldShare, double truthfulness) {
            this.shouldShare = shouldShare;
            this.truthfulness = truthfulness;
        }

        public boolean shouldShare() { return shouldShare; }

        /**
         * 1.0 retells exactly what happened, lower values invite distortion
         */
        public double getTruthfulness() { return truthfulness; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SharingRule)) return false;
            SharingRule other = (SharingRule) o;
            return shouldShare == other.shouldShare && Double.compare(truthfulness, other.truthfulness) == 0;
        }

        @Override
        public int hashCode() {
            return 31 * Boolean.hashCode(shouldShare) + Double.hashCode(truthfulness);
        }

        @Override
        public String toString() {
            return "(" + shouldShare + ", " + truthfulness + ")";
        }
    }
}
