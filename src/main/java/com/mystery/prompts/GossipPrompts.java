package com.mystery.prompts;

import java.util.Locale;
import java.util.Map;

/**
 * Prompts for characters talking among themselves after an interrogation
 */
public class GossipPrompts {

    public static String getRelayPrompt(String speaker, String listener, String relationship,
                                        String question, String answer, Map<String, Integer> speakerLevels,
                                        double truthfulness) {
        return String.format(Locale.ROOT, """
        You are %s. You were just interrogated by a detective.

        Detective asked: "%s"
        You responded: "%s"

        Now you're telling %s (%s) about it.

        Your personality: Trust %d/5, Anxious %d/5, Moody %d/5
        Truthfulness level: %.2f (1.00 = exactly what happened, lower = leave things out, twist them or lie)

        Tell them about the interrogation naturally (1-2 sentences). Adjust your honesty to match your truthfulness level.
        Return ONLY what you say to them.
        """,
            speaker, question, answer, listener, relationship,
            speakerLevels.getOrDefault("Trust", 3), speakerLevels.getOrDefault("Anxious", 3),
            speakerLevels.getOrDefault("Moody", 3), truthfulness);
    }

    public static String getReactionPrompt(String listener, String speaker, String relationship,
                                           String relayed, Map<String, Integer> listenerLevels) {
        return String.format("""
        You are %s.

        %s (%s) just told you: "%s"

        Your personality: Trust %d/5, Anxious %d/5, Moody %d/5

        React to what they said naturally (1-2 sentences). Return ONLY your reaction.
        """,
            listener, speaker, relationship, relayed,
            listenerLevels.getOrDefault("Trust", 3), listenerLevels.getOrDefault("Anxious", 3),
            listenerLevels.getOrDefault("Moody", 3));
    }
}
