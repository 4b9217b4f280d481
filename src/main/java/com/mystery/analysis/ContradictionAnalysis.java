package com.mystery.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Contradictions found for one suspect. Only exists when at least one contradiction was found.
 */
public final class ContradictionAnalysis {
    private static final double PENALTY_PER_CONTRADICTION = 0.25;

    private final String character;
    private final int totalStatements;
    private final List<Contradiction> contradictions;
    private final double consistencyScore;

    private ContradictionAnalysis(String character, int totalStatements, List<Contradiction> contradictions) {
        this.character = character;
        this.totalStatements = totalStatements;
        this.contradictions = List.copyOf(contradictions);
        this.consistencyScore = score(contradictions.size());
    }

    public static Optional<ContradictionAnalysis> of(String character, int totalStatements, List<Contradiction> contradictions) {
        if (contradictions == null || contradictions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ContradictionAnalysis(character, totalStatements, contradictions));
    }

    /**
     * 1.0 is fully consistent, 0.0 contradictory
     */
    public static double score(int contradictionCount) {
        return Math.max(0.0, 1.0 - PENALTY_PER_CONTRADICTION * contradictionCount);
    }

    public String getCharacter() { return character; }
    public int getTotalStatements() { return totalStatements; }
    public List<Contradiction> getContradictions() { return contradictions; }
    public double getConsistencyScore() { return consistencyScore; }
}
