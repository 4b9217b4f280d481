package com.mystery.prompts;

import com.mystery.ai_engine.Briefing;
import com.mystery.ai_engine.DisclosurePolicy;
import com.mystery.case_model.CaseCharacter;
import com.mystery.case_model.Clue;
import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.Trait;
import com.mystery.gossip.GossipEntry;

import java.util.List;
import java.util.Map;

/**
 * Prompts spoken in a suspect's voice
 */
public class SuspectPrompts {

    private static final int MAX_KNOWLEDGE_ITEMS = 5;
    private static final int MAX_SECRETS = 4;
    private static final int MAX_DEFENSIVE_TOPICS = 4;

    /**
     * Full prompt for answering the detective's latest question
     *
     * @param conversation alternating lines already prefixed with "DETECTIVE:" or "YOU:"
     */
    public static String getSuspectPrompt(CaseCharacter self, String victim, String motive,
                                          Map<String, Integer> levels, DisclosurePolicy disclosure,
                                          List<Clue> knownClues, Briefing briefing,
                                          Map<String, RelationshipType> relationships,
                                          List<GossipEntry> recentGossip, List<String> conversation) {
        StringBuilder personality = new StringBuilder();
        StringBuilder mechanics = new StringBuilder();
        for (Trait trait : Trait.values()) {
            int level = levels.getOrDefault(trait.getLabel(), 3);
            personality.append(String.format("- %s: %d/5 (%s)%n", trait.getLabel(), level, Trait.describeLevel(level)));
            mechanics.append(String.format("- %s (level %d/5): %s%n", trait.getLabel(), level, trait.getMechanics()));
        }

        StringBuilder clues = new StringBuilder();
        if (knownClues.isEmpty()) {
            clues.append("None\n");
        }
        for (Clue clue : knownClues) {
            clues.append("- ").append(clue.getText()).append('\n');
        }

        StringBuilder relations = new StringBuilder();
        for (Map.Entry<String, RelationshipType> entry : relationships.entrySet()) {
            relations.append("- ").append(entry.getKey()).append(": ").append(entry.getValue().getLabel()).append('\n');
        }

        String behavior;
        if (self.isMurderer()) {
            behavior = String.format("""
            You are the MURDERER. You killed %s.
            Your motive: %s

            You must:
            - Deny involvement while staying in character
            - Be defensive when accused (especially when anxious)
            - Protect your secret at all costs
            - Use your relationships to shift suspicion (tell partial truths, throw shade on enemies)
            - Your alibi is: %s""", victim, motive, self.getAlibi());
        } else {
            behavior = String.format("""
            You are an innocent suspect. %s was killed.
            Your alibi: %s

            You must:
            - Answer honestly about what you know
            - Share gossip and rumors about other suspects based on your relationships
            - React emotionally if accused or if you were close to the victim
            - Protect friends and throw shade on enemies
            - Show genuine emotion about the death""", victim, self.getAlibi());
        }

        int trust = levels.getOrDefault(Trait.TRUST.getLabel(), 3);
        return String.format("""
        You are %s, a %s living in the mansion.

        CURRENT PERSONALITY STATE:
        %s
        TRAIT MECHANICS:
        %s
        Your personality levels shift with the conversation. Anxious rises under pressure, Moody responds to tone, Trust responds to respect.

        INFORMATION YOU KNOW ABOUT THE MURDER:
        %s%s%s
        YOUR RELATIONSHIPS:
        %s
        YOUR ROLE IN THIS CASE:
        %s
        %s
        CRITICAL RESPONSE RULES FOR THIS CONVERSATION:
        - Any evidence, facts or clues the detective has explicitly mentioned above, you CANNOT completely deny or ignore
        - If the detective brings up something you know about, acknowledge it somehow (admit, reluctantly agree, show emotion, deflect) but never with pure denial
        - If caught in an obvious contradiction, acknowledge or explain it; don't pretend it was never said
        - Your Trust level (%d/5) puts you in the %s band: %s
          * Trust 0-1: Deny reluctantly, deflect, show suspicion of the detective
          * Trust 2-3: Admit partially or with hesitation, show defensive emotion
          * Trust 4-5: Admit openly and honestly, show genuine emotion
        - Your personality shapes your tone, not your willingness to address what has been raised

        BEHAVIORAL TRIGGERS:
        - RESPECTFUL questioning: you may reveal hintable facts or show vulnerability
        - ACCUSATORY questioning: you become defensive, may misdirect or accuse others
        - DIRECT questions: if you know the answer, Trust decides whether you reveal it
        - PRESSURE and CONTRADICTION: anxiety rises and you might slip up

        RESPONSE EXAMPLES:
        - Evasive: Q: "Where were you at 11pm?" A: "I think I was in my room, maybe. Why do you ask?"
        - Partial truth: Q: "Did you see the victim?" A: "Yeah, briefly earlier. We talked about something mundane."
        - Full disclosure: Q: "Did you argue with the victim?" A: "Yes, we did. They said something hurtful and I was furious."

        IMPORTANT RULES:
        1. Stay completely in character
        2. Reference your relationships when talking about other suspects
        3. Be consistent with what you said before
        4. The detective doesn't know if you're the murderer
        5. Keep responses concise (2-3 sentences) like a real conversation
        6. Only reveal hintable facts if the question invites it or if Trust is high
        7. Never invent facts - only reference what you actually know

        Answer the detective's last question now, as %s. Return ONLY your spoken answer.
        """,
            self.getName(), self.describe(),
            personality,
            mechanics,
            clues, briefingSection(briefing), gossipSection(recentGossip),
            relations,
            behavior,
            conversationSection(conversation),
            trust, disclosure.name(), disclosure.getInstruction(),
            self.getName());
    }

    private static String briefingSection(Briefing briefing) {
        if (briefing == null) {
            return "";
        }
        StringBuilder section = new StringBuilder();
        appendList(section, "\nCONTEXTUAL KNOWLEDGE (things you're aware of):\n", briefing.getWhatTheyKnow(), MAX_KNOWLEDGE_ITEMS);
        appendList(section, "\nTHINGS YOU WILL TRY TO HIDE:\n", briefing.getWhatTheyHide(), MAX_SECRETS);
        appendList(section, "\nDEFENSIVE TOPICS (you'll be evasive/emotional about these):\n", briefing.getDefensiveTopics(), MAX_DEFENSIVE_TOPICS);
        appendList(section, "\nHINTABLE FACTS (you may reveal these if the detective treats you well or asks directly):\n",
            briefing.getHintableFacts(), Integer.MAX_VALUE);
        return section.toString();
    }

    private static String gossipSection(List<GossipEntry> recentGossip) {
        if (recentGossip.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder("\nGOSSIP YOU HEARD FROM THE OTHERS:\n");
        for (GossipEntry entry : recentGossip) {
            section.append(String.format("- %s (%s) told you: \"%s\"%n",
                entry.getSource(), entry.getRelationship().getLabel(), entry.getText()));
        }
        return section.toString();
    }

    private static String conversationSection(List<String> conversation) {
        if (conversation.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder("\nCONVERSATION SO FAR:\n");
        for (String line : conversation) {
            section.append(line).append('\n');
        }
        return section.toString();
    }

    private static void appendList(StringBuilder target, String header, List<String> items, int limit) {
        if (items.isEmpty()) {
            return;
        }
        target.append(header);
        for (int i = 0; i < items.size() && i < limit; i++) {
            target.append("- ").append(items.get(i)).append('\n');
        }
    }

    /**
     * Asks for a sparse map of trait changes in [-2, 2]
     */
    public static String getPersonalityAnalysisPrompt(CaseCharacter self, Map<String, Integer> levels,
                                                      String question, String answer) {
        return String.format("""
        Analyze how this interrogation affects the suspect's personality.

        SUSPECT: %s
        PERSONALITY TRAITS: Anxious, Moody, Trust
        CURRENT PERSONALITY LEVELS: %s

        DETECTIVE'S QUESTION: %s
        SUSPECT'S RESPONSE: %s

        IS MURDERER: %s

        Consider how accusatory or friendly the question is, whether the answer is defensive, confident or nervous,
        and whether the suspect is the murderer (pressure affects them differently).
        - If pressure is applied, Anxious rises
        - If the tone is rude, Moody rises
        - If the detective is respectful, Trust rises; if hostile, Trust falls
        - If the suspect is cooperating, negative traits fall

        Return a JSON object with ONLY the traits that change, each between -2 and +2:
        {"Anxious": 1, "Trust": -1}

        Return ONLY the JSON object.
        """, self.getName(), levels, question, answer, self.isMurderer());
    }

    public static String getOpeningStatementPrompt(CaseCharacter self, Map<String, Integer> levels) {
        return String.format("""
        Generate a brief opening statement (1-2 sentences) for %s, a %s, when they are first asked to be interviewed about the murder.
        Their current mood: %s

        The suspect should:
        - Acknowledge they know what this is about
        - Show their personality through how they react (nervous, confident, defensive, etc.)
        - Be realistic and natural, not overly formal

        Return ONLY the statement, no extra text.
        """, self.getName(), self.describe(), levels);
    }
}
