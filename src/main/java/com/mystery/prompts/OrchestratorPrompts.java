package com.mystery.prompts;

import com.mystery.case_model.CaseCharacter;
import com.mystery.case_model.CaseModel;
import com.mystery.case_model.Clue;
import com.mystery.case_model.RelationshipType;

import java.util.List;
import java.util.Map;

/**
 * Prompts used by the narrative orchestrator and the investigation log
 */
public class OrchestratorPrompts {

    public static String getHintableFactsPrompt(CaseModel caseModel, CaseCharacter suspect,
                                                Map<String, RelationshipType> relationships, List<Clue> ownedClues) {
        StringBuilder context = new StringBuilder();
        context.append(String.format("SUSPECT: %s (%s)%n", suspect.getName(), suspect.describe()));
        context.append(String.format("ROLE: %s%n", suspect.getRole().getValue().toUpperCase()));
        context.append(String.format("VICTIM: %s%n", caseModel.getVictim()));
        context.append(String.format("MURDERER: %s%n", caseModel.getMurderer()));
        context.append(String.format("MOTIVE: %s%n%n", caseModel.getMotive()));
        context.append("RELATIONSHIPS WITH OTHER SUSPECTS:\n");
        for (Map.Entry<String, RelationshipType> entry : relationships.entrySet()) {
            context.append(String.format("  - %s: %s%n", entry.getKey(), entry.getValue().getLabel()));
        }
        context.append("\nKNOWN CLUES:\n");
        for (Clue clue : ownedClues) {
            context.append("  - ").append(clue.getText()).append('\n');
        }

        return String.format("""
        You are a detective briefing assistant. Generate 2-3 specific, hintable facts that %s might reveal during interrogation if the detective asks the right questions or treats them well.

        %s
        These hintable facts should be:
        1. CONTEXTUALLY RELEVANT: based on their relationships, role and what they know
        2. SPECIFIC: include names, times or concrete details when possible
        3. REVEALABLE: things they would naturally know and might slip up about
        4. USEFUL: facts that would help solve the mystery

        If MURDERER: details they might slip up about (location, time, interactions with the victim)
        If INNOCENT: gossip about others, suspicious observations, relationship conflicts

        Return ONLY a JSON array of 2-3 strings, no other text. Example:
        ["saw Lisa leave the study at 11:45pm", "heard James arguing with the victim", "found the key to the study"]
        """, suspect.getName(), context);
    }

    public static String getSnippetPrompt(String suspectName, List<String> transcript) {
        return String.format("""
        Analyze this interview with %s and write ONE short suspicious or notable observation (5-7 words max).
        Example: "David seemed nervous about Emma"

        Transcript:
        %s
        Observation:""", suspectName, String.join("\n", transcript));
    }
}
