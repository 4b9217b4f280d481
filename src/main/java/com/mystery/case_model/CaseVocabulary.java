package com.mystery.case_model;

import java.util.List;

/**
 * Controlled vocabularies offered to the model when drawing a case
 */
public final class CaseVocabulary {

    public static final List<String> MOTIVES = List.of(
        "Jealousy over a romantic relationship",
        "Financial gain or inheritance",
        "Revenge for past wrongs",
        "Protecting a secret",
        "Eliminating competition",
        "Accidental crime during argument"
    );

    public static final List<String> MANSION_LOCATIONS = List.of(
        "The victim's bedroom",
        "The mansion's library",
        "The dining room",
        "The guest house",
        "The wine cellar",
        "The study",
        "The conservatory",
        "The drawing room"
    );

    public static final List<String> CAUSES_OF_DEATH = List.of(
        "Poisoning (antifreeze in their wine glass)",
        "Blunt force trauma (hit with a marble statue)",
        "Suffocation (smothered with a pillow)",
        "Stabbing (with a letter opener from the study)",
        "Strangulation (with a rope from the garden shed)",
        "Medication overdose (their own pills tampered with)"
    );

    public static final List<String> TIMES_OF_DEATH = List.of(
        "Around 10:30 PM last night",
        "Around 11:45 PM last night",
        "Around 9:15 PM last night",
        "Around 12:30 AM",
        "Around 8:45 PM last night"
    );

    public static final List<String> CLUE_CATEGORIES = List.of(
        "physical evidence", "witness statement", "financial", "relationship"
    );

    public static final String DEFAULT_ALIBI = "I was minding my own business.";
    public static final String DEFAULT_MOTIVE = "Unknown motive";
    public static final String DEFAULT_LOCATION = "Unknown location";
    public static final String DEFAULT_CAUSE = "Unknown cause";
    public static final String DEFAULT_TIME = "Unknown time";

    private CaseVocabulary() {
    }
}
