package com.mystery.game_state;

import java.util.List;

/**
 * Verdict on the detective's final accusation. The real murderer and motive are always disclosed.
 */
public final class AccusationResult {
    private final String accused;
    private final boolean correct;
    private final String accusedDescription;
    private final String realMurderer;
    private final String motive;
    private final String method;
    private final String location;
    private final String time;
    private final List<String> evidence;

    public AccusationResult(String accused, boolean correct, String accusedDescription, String realMurderer,
                            String motive, String method, String location, String time, List<String> evidence) {
        this.accused = accused;
        this.correct = correct;
        this.accusedDescription = accusedDescription;
        this.realMurderer = realMurderer;
        this.motive = motive;
        this.method = method;
        this.location = location;
        this.time = time;
        this.evidence = List.copyOf(evidence);
    }

    public String getAccused() { return accused; }
    public boolean isCorrect() { return correct; }
    public String getAccusedDescription() { return accusedDescription; }
    public String getRealMurderer() { return realMurderer; }
    public String getMotive() { return motive; }
    public String getMethod() { return method; }
    public String getLocation() { return location; }
    public String getTime() { return time; }

    /**
     * Key evidence against the murderer when correct, otherwise why the accused looked suspicious
     */
    public List<String> getEvidence() { return evidence; }

    public String getVerdict() {
        return correct ? "correct" : "incorrect";
    }

    public String getCaseStatus() {
        return correct ? "SOLVED" : "UNSOLVED - Investigation continues...";
    }
}
