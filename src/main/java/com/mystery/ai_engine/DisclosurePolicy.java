package com.mystery.ai_engine;

/**
 * How much a suspect gives away, fixed by their Trust level
 */
public enum DisclosurePolicy {
    DENY_DEFLECT(1,
        "Deny reluctantly, deflect, show suspicion of the detective",
        "I don't see why I should answer that. Ask someone else."),
    PARTIAL_ADMISSION(3,
        "Admit partially or with hesitation, show defensive emotion",
        "I... I need a moment. Can we come back to that?"),
    FULL_ADMISSION(5,
        "Admit openly and honestly, show genuine emotion",
        "Sorry, my head is spinning. Ask me again in a moment and I'll tell you what I can.");

    private final int maxTrust;
    private final String instruction;
    private final String fallbackLine;

    DisclosurePolicy(int maxTrust, String instruction, String fallbackLine) {
        this.maxTrust = maxTrust;
        this.instruction = instruction;
        this.fallbackLine = fallbackLine;
    }

    public static DisclosurePolicy forTrust(int trust) {
        if (trust <= DENY_DEFLECT.maxTrust) {
            return DENY_DEFLECT;
        }
        if (trust <= PARTIAL_ADMISSION.maxTrust) {
            return PARTIAL_ADMISSION;
        }
        return FULL_ADMISSION;
    }

    /**
     * Sentence handed to the model describing how to answer
     */
    public String getInstruction() { return instruction; }

    /**
     * In-character line used when no answer could be generated
     */
    public String getFallbackLine() { return fallbackLine; }
}
