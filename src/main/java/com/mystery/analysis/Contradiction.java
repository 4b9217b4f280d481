package com.mystery.analysis;

public final class Contradiction {
    private final String previous;
    private final String current;
    private final String context;

    public Contradiction(String previous, String current, String context) {
        this.previous = previous;
        this.current = current;
        this.context = context;
    }

    public String getPrevious() { return previous; }
    public String getCurrent() { return current; }

    /**
     * The question the contradicting statement answered
     */
    public String getContext() { return context; }
}
