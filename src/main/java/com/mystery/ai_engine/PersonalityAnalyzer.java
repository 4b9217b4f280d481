package com.mystery.ai_engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.mystery.case_model.CaseCharacter;
import com.mystery.game_state.PersonalityState;
import com.mystery.game_state.Trait;
import com.mystery.messages.JsonResponseParser;
import com.mystery.prompts.SuspectPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns one question/answer exchange into a sparse map of trait deltas.
 * Anything malformed is treated as "no change".
 */
public class PersonalityAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(PersonalityAnalyzer.class);

    static final double ANALYSIS_TEMPERATURE = 0.7;
    static final int ANALYSIS_MAX_TOKENS = 200;

    private final TextGenerationService textService;

    public PersonalityAnalyzer(TextGenerationService textService) {
        this.textService = textService;
    }

    public Map<Trait, Integer> analyze(CaseCharacter suspect, Map<String, Integer> levels, String question, String answer) {
        String prompt = SuspectPrompts.getPersonalityAnalysisPrompt(suspect, levels, question, answer);
        try {
            String response = textService.generate(prompt, ANALYSIS_TEMPERATURE, ANALYSIS_MAX_TOKENS);
            return parseDeltas(response);
        } catch (GenerationException | IllegalArgumentException e) {
            logger.warn("⚠️ [PersonalityAnalyzer] No personality change for {}: {}", suspect.getName(), e.getMessage());
            return new EnumMap<>(Trait.class);
        }
    }

    /**
     * Keeps known traits with numeric values, rounded and clamped to [-2, 2]; zero deltas are dropped
     */
    static Map<Trait, Integer> parseDeltas(String response) {
        JsonObject json = JsonResponseParser.parseJsonObject(response);
        Map<Trait, Integer> deltas = new EnumMap<>(Trait.class);
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            Trait trait = Trait.parse(entry.getKey());
            if (trait == null) {
                continue;
            }
            JsonElement value = entry.getValue();
            if (!value.isJsonPrimitive()) {
                continue;
            }
            double raw;
            try {
                raw = value.getAsDouble();
            } catch (NumberFormatException e) {
                logger.debug("[PersonalityAnalyzer] Ignoring non-numeric delta {}={}", entry.getKey(), value);
                continue;
            }
            if (Double.isNaN(raw) || Double.isInfinite(raw)) {
                logger.debug("[PersonalityAnalyzer] Ignoring non-finite delta {}={}", entry.getKey(), value);
                continue;
            }
            int delta = (int) Math.round(Math.max(-PersonalityState.MAX_DELTA, Math.min(PersonalityState.MAX_DELTA, raw)));
            if (delta != 0) {
                deltas.put(trait, delta);
            }
        }
        return deltas;
    }
}
