package com.mystery.game_state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One answered question: what was asked, what was said and how the suspect felt afterwards
 */
public final class InteractionRecord {
    private final String question;
    private final String response;
    private final Map<String, Integer> personalityAfter;
    private final int ordinal;

    public InteractionRecord(String question, String response, Map<String, Integer> personalityAfter, int ordinal) {
        this.question = question;
        this.response = response;
        this.personalityAfter = Collections.unmodifiableMap(new LinkedHashMap<>(personalityAfter));
        this.ordinal = ordinal;
    }

    public String getQuestion() { return question; }
    public String getResponse() { return response; }
    public Map<String, Integer> getPersonalityAfter() { return personalityAfter; }

    /**
     * 1-based position in the character's interrogation history
     */
    public int getOrdinal() { return ordinal; }
}
