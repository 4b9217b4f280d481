package com.mystery.game_state;

import java.util.Locale;

/**
 * The three personality traits every suspect carries.
 * Trust rising means more cooperative; Anxiety and Moodiness rising mean more evasive and hostile.
 */
public enum Trait {
    ANXIETY("Anxious", "When high, you tend to mix up facts and may lie to feel less anxious. When low, you're calm and collected."),
    MOODINESS("Moody", "When high, you act sassy and irritable. When low, you're pleasant and cooperative."),
    TRUST("Trust", "Increases if treated with respect. When high trust, you tell the truth. When low trust, you're defensive and secretive.");

    private final String label;
    private final String mechanics;

    Trait(String label, String mechanics) {
        this.label = label;
        this.mechanics = mechanics;
    }

    public String getLabel() {
        return label;
    }

    public String getMechanics() {
        return mechanics;
    }

    /**
     * Accepts the label ("Anxious"), the trait name ("Anxiety") or the enum name, ignoring case.
     *
     * @return the trait, or null for anything else
     */
    public static Trait parse(String text) {
        if (text == null) {
            return null;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "anxious":
            case "anxiety":
                return ANXIETY;
            case "moody":
            case "moodiness":
                return MOODINESS;
            case "trust":
            case "trusting":
                return TRUST;
            default:
                return null;
        }
    }

    public static String describeLevel(int level) {
        switch (level) {
            case 0: return "Completely suppressed";
            case 1: return "Very low";
            case 2: return "Low";
            case 3: return "Neutral/Normal";
            case 4: return "High";
            case 5: return "Extremely high";
            default: return "Unknown";
        }
    }
}
