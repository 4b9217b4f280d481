package com.mystery.analysis;

/**
 * Something a suspect said, with the question it answered
 */
public final class Statement {
    private final String text;
    private final String questionContext;
    private final int ordinal;

    public Statement(String text, String questionContext, int ordinal) {
        this.text = text;
        this.questionContext = questionContext;
        this.ordinal = ordinal;
    }

    public String getText() { return text; }
    public String getQuestionContext() { return questionContext; }
    public int getOrdinal() { return ordinal; }
}
