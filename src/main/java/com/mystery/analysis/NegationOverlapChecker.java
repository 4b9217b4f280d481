package com.mystery.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Baseline checker: a statement contradicts its predecessor when it contains an explicit negation
 * and the question it answers overlaps what was said before.
 */
public class NegationOverlapChecker implements ConsistencyChecker {
    private static final Pattern NEGATION = Pattern.compile(
        "\\b(didn't|didn’t|did not|never|wasn't|wasn’t|was not|weren't|haven't|hadn't|don't|don’t|do not)\\b");

    @Override
    public List<Contradiction> findContradictions(List<Statement> statements) {
        List<Contradiction> contradictions = new ArrayList<>();
        for (int i = 1; i < statements.size(); i++) {
            Statement previous = statements.get(i - 1);
            Statement current = statements.get(i);
            if (containsNegation(current.getText())
                && TextOverlap.overlaps(current.getQuestionContext(), previous.getText())) {
                contradictions.add(new Contradiction(previous.getText(), current.getText(), current.getQuestionContext()));
            }
        }
        return contradictions;
    }

    static boolean containsNegation(String text) {
        return text != null && NEGATION.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
