package com.mystery.ai_engine;

import com.mystery.analysis.TextOverlap;
import com.mystery.case_model.Clue;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which clues an answer gave away: the answer quotes the clue, or repeats at least half of
 * its significant words (and at least two of them).
 */
public final class ClueRevealDetector {

    private ClueRevealDetector() {
    }

    public static List<Clue> revealedBy(String answer, List<Clue> clues) {
        List<Clue> revealed = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            return revealed;
        }
        for (Clue clue : clues) {
            if (TextOverlap.overlaps(clue.getText(), answer)) {
                revealed.add(clue);
            }
        }
        return revealed;
    }
}
