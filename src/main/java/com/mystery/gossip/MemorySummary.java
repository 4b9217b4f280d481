package com.mystery.gossip;

import java.util.Optional;

/**
 * Latest memory kept for a character and its summary, when the store could produce one
 */
public final class MemorySummary {
    private final String handle;
    private final String summaryText;

    public MemorySummary(String handle, String summaryText) {
        this.handle = handle;
        this.summaryText = summaryText;
    }

    public String getHandle() {
        return handle;
    }

    public Optional<String> getSummaryText() {
        return Optional.ofNullable(summaryText).filter(text -> !text.isBlank());
    }
}
