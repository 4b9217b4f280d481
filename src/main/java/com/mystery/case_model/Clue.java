package com.mystery.case_model;

import java.util.Locale;
import java.util.Objects;

/**
 * A piece of information planted in the case. Only its revealed status changes, and that is tracked by the orchestrator.
 */
public final class Clue {
    private final String text;
    private final String owner;
    private final boolean truthful;
    private final String category;

    public Clue(String text, String owner, boolean truthful, String category) {
        this.text = Objects.requireNonNull(text, "text");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.truthful = truthful;
        this.category = category != null ? category.trim().toLowerCase(Locale.ROOT) : "";
    }

    public String getText() {
        return text;
    }

    /**
     * Primary knower of the clue
     */
    public String getOwner() {
        return owner;
    }

    public boolean isTruthful() {
        return truthful;
    }

    public String getCategory() {
        return category;
    }

    public boolean mentions(String word) {
        return text.toLowerCase(Locale.ROOT).contains(word.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clue)) return false;
        Clue other = (Clue) o;
        return truthful == other.truthful
            && text.equals(other.text)
            && owner.equals(other.owner)
            && category.equals(other.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, owner, truthful, category);
    }

    @Override
    public String toString() {
        return "Clue{" + owner + ": " + text + (truthful ? "" : " (false)") + "}";
    }
}
