package com.mystery.game_state;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Bounded trait vector of one suspect. Values live in [0,5]; the observable level is the rounded value.
 * Analysis deltas are whole levels, gossip shifts are fractional and accumulate before rounding.
 */
public class PersonalityState {
    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 5;
    public static final int MAX_DELTA = 2;

    // cumulative probabilities for levels 0..5
    private static final double[] INITIAL_DISTRIBUTION = {0.05, 0.15, 0.35, 0.65, 0.85, 1.0};

    private final Map<Trait, Double> values = new EnumMap<>(Trait.class);

    public PersonalityState(int anxiety, int moodiness, int trust) {
        values.put(Trait.ANXIETY, clamp(anxiety));
        values.put(Trait.MOODINESS, clamp(moodiness));
        values.put(Trait.TRUST, clamp(trust));
    }

    /**
     * Draws each trait from a centre-weighted distribution: extremes are rare, 3 is the most common level
     */
    public static PersonalityState random(Random random) {
        return new PersonalityState(drawLevel(random), drawLevel(random), drawLevel(random));
    }

    static int drawLevel(Random random) {
        double roll = random.nextDouble();
        for (int level = 0; level < INITIAL_DISTRIBUTION.length; level++) {
            if (roll < INITIAL_DISTRIBUTION[level]) {
                return level;
            }
        }
        return MAX_LEVEL;
    }

    public synchronized int getLevel(Trait trait) {
        return (int) Math.round(values.get(trait));
    }

    public synchronized double getValue(Trait trait) {
        return values.get(trait);
    }

    /**
     * value' = clamp(value + delta, 0, 5) for each trait in the map, keeping any fractional gossip shift;
     * others are unchanged.
     * Deltas outside [-2,2] are clamped first.
     *
     * @return the deltas actually requested after clamping to [-2,2]
     */
    public synchronized Map<Trait, Integer> applyAnalysis(Map<Trait, Integer> deltas) {
        Map<Trait, Integer> applied = new EnumMap<>(Trait.class);
        for (Map.Entry<Trait, Integer> entry : deltas.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            int delta = clampDelta(entry.getValue());
            values.put(entry.getKey(), clamp(values.get(entry.getKey()) + delta));
            applied.put(entry.getKey(), delta);
        }
        return applied;
    }

    /**
     * Fractional shift from hearing gossip; accumulates and is clamped to [0,5]
     */
    public synchronized void shift(Trait trait, double amount) {
        values.put(trait, clamp(values.get(trait) + amount));
    }

    /**
     * Integer levels keyed by trait label, e.g. {"Anxious": 3, "Moody": 2, "Trust": 4}
     */
    public synchronized Map<String, Integer> snapshot() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (Trait trait : Trait.values()) {
            levels.put(trait.getLabel(), getLevel(trait));
        }
        return levels;
    }

    public static int clampDelta(int delta) {
        return Math.max(-MAX_DELTA, Math.min(MAX_DELTA, delta));
    }

    private static double clamp(double value) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, value));
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
