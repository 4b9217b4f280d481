package com.mystery.prompts;

import com.mystery.case_model.CaseVocabulary;
import com.mystery.case_model.RelationshipType;
import com.mystery.case_model.SuspectRoster;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompts for drawing a new case
 */
public class CasePrompts {

    public static String getCaseGenerationPrompt() {
        StringBuilder suspects = new StringBuilder();
        for (SuspectRoster.Profile profile : SuspectRoster.profiles()) {
            suspects.append(String.format("- %s: %d year old %s %s, personality: %s%n",
                profile.getName(), profile.getAge(), profile.getGender(), profile.getOccupation(),
                String.join(", ", profile.getTraits())));
        }

        List<String> names = SuspectRoster.names();
        List<String> labels = new ArrayList<>();
        for (RelationshipType type : RelationshipType.values()) {
            labels.add(type.getLabel());
        }

        StringBuilder alibis = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            alibis.append(String.format("        \"%s\": \"their alibi\"%s%n", names.get(i), i < names.size() - 1 ? "," : ""));
        }
        StringBuilder pairs = new StringBuilder();
        List<String> pairKeys = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                pairKeys.add(names.get(i) + "_" + names.get(j));
            }
        }
        for (int i = 0; i < pairKeys.size(); i++) {
            pairs.append(String.format("        \"%s\": \"relationship_type\"%s%n", pairKeys.get(i), i < pairKeys.size() - 1 ? "," : ""));
        }

        return String.format("""
        You are a master storyteller for a murder mystery game set in a MANSION where all 6 suspects live together.

        These are the 6 fixed characters (same traits every game):
        %s
        Suspect names: %s

        MANSION CONTEXT:
        - All 6 suspects live in a large mansion together
        - They were all present in the mansion last night when the murder occurred
        - The murder happened between 8 PM and 1 AM
        - No one left the mansion - all doors were locked

        Your job for THIS game:
        1. Select one suspect as the VICTIM (killed last night in the mansion)
        2. Select a DIFFERENT suspect as the MURDERER
        3. For each pair of suspects, assign a RELATIONSHIP TYPE from: %s
        4. Assign a MOTIVE to the murderer from: %s
        5. Create a plausible ALIBI for each suspect (what they claim they were doing in the mansion)
        6. Choose the LOCATION where the body was found from: %s
        7. Choose the CAUSE OF DEATH from: %s
        8. Choose the ESTIMATED TIME OF DEATH from: %s
        9. Generate 2 to 4 CLUES that could help or mislead the detective (some true, some false)

        IMPORTANT:
        - ALL 6 SUSPECTS must have alibis
        - Every pair must have exactly one relationship, and it is the same in both directions
        - The murderer's alibi should be vague or show signs they're lying
        - Some alibis should partially corroborate each other
        - Clues are known by one suspect each and must be discoverable through interrogation

        Return ONLY a valid JSON object with this exact structure:
        {
            "victim": "name_of_victim",
            "murderer": "name_of_murderer",
            "murderer_motive": "detailed reason for killing",
            "crime_location": "location in mansion where body was found",
            "cause_of_death": "how the victim was killed",
            "time_of_death": "estimated time of death",
            "alibis": {
        %s    },
            "relationships": {
        %s    },
            "clues": [
                {
                    "clue": "description of the clue",
                    "known_by": "which suspect knows this clue",
                    "is_true": true,
                    "category": "%s"
                }
            ]
        }
        """,
            suspects,
            String.join(", ", names),
            String.join(", ", labels),
            String.join(", ", CaseVocabulary.MOTIVES),
            String.join(", ", CaseVocabulary.MANSION_LOCATIONS),
            String.join(", ", CaseVocabulary.CAUSES_OF_DEATH),
            String.join(", ", CaseVocabulary.TIMES_OF_DEATH),
            alibis,
            pairs,
            String.join("/", CaseVocabulary.CLUE_CATEGORIES));
    }
}
