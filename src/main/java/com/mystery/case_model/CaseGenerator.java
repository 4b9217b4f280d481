package com.mystery.case_model;

import com.mystery.ai_engine.GenerationException;
import com.mystery.ai_engine.TextGenerationService;
import com.mystery.messages.JsonResponseParser;
import com.mystery.prompts.CasePrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws a case from the text generation service and validates it at the boundary.
 * Either a complete {@link CaseModel} comes out or a {@link CaseGenerationException} is thrown.
 */
public class CaseGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CaseGenerator.class);

    static final double CASE_TEMPERATURE = 0.8;
    static final int CASE_MAX_TOKENS = 2000;
    static final int MAX_CLUES = 4;

    private final TextGenerationService textService;

    public CaseGenerator(TextGenerationService textService) {
        this.textService = textService;
    }

    /**
     * One structured generation request. The caller may retry or abort on failure.
     */
    public CaseModel generate() {
        logger.info("🎭 [CaseGenerator] Drawing a new case...");
        String response;
        try {
            response = textService.generate(CasePrompts.getCaseGenerationPrompt(), CASE_TEMPERATURE, CASE_MAX_TOKENS);
        } catch (GenerationException e) {
            throw new CaseGenerationException("Case generation request failed: " + e.getMessage(), e);
        }
        CaseModel model = fromJson(response);
        logger.info("✅ [CaseGenerator] Case ready: victim {}, {} clues", model.getVictim(), model.getClues().size());
        return model;
    }

    /**
     * Builds a case from stored or generated JSON with the same validation as {@link #generate()}
     */
    public static CaseModel fromJson(String json) {
        CaseDraft draft;
        try {
            draft = JsonResponseParser.parseObject(json, CaseDraft.class);
        } catch (IllegalArgumentException e) {
            throw new CaseGenerationException("Unparseable case: " + e.getMessage(), e);
        }
        return fromDraft(draft);
    }

    /**
     * Reads a stored case from the classpath, e.g. {@code cases/sample-case.json}
     */
    public static CaseModel fromResource(String resource) {
        try (InputStream in = CaseGenerator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CaseGenerationException("No stored case at " + resource);
            }
            CaseModel model = fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("📂 [CaseGenerator] Loaded stored case {}: victim {}", resource, model.getVictim());
            return model;
        } catch (IOException e) {
            throw new CaseGenerationException("Could not read " + resource + ": " + e.getMessage(), e);
        }
    }

    static CaseModel fromDraft(CaseDraft draft) {
        List<String> names = SuspectRoster.names();

        String victim = requireRosterName("victim", draft.victim);
        String murderer = requireRosterName("murderer", draft.murderer);
        if (victim.equals(murderer)) {
            throw new CaseGenerationException("Murderer and victim are both " + victim);
        }

        RelationshipGraph relationships = RelationshipGraph.fromPairs(names, draft.relationships);

        Map<String, String> alibis = canonicalAlibis(draft.alibis);
        Map<String, CaseCharacter> characters = new LinkedHashMap<>();
        for (SuspectRoster.Profile profile : SuspectRoster.profiles()) {
            String name = profile.getName();
            CharacterRole role = name.equals(victim) ? CharacterRole.VICTIM
                : name.equals(murderer) ? CharacterRole.MURDERER
                : CharacterRole.INNOCENT;
            String alibi = alibis.get(name);
            if (isBlank(alibi)) {
                logger.warn("⚠️ [CaseGenerator] No alibi for {}, using the default", name);
                alibi = CaseVocabulary.DEFAULT_ALIBI;
            }
            characters.put(name, new CaseCharacter(profile, role, alibi.trim()));
        }

        return new CaseModel(
            victim,
            murderer,
            orDefault(draft.murdererMotive, CaseVocabulary.DEFAULT_MOTIVE),
            orDefault(draft.crimeLocation, CaseVocabulary.DEFAULT_LOCATION),
            orDefault(draft.causeOfDeath, CaseVocabulary.DEFAULT_CAUSE),
            orDefault(draft.timeOfDeath, CaseVocabulary.DEFAULT_TIME),
            characters,
            relationships,
            validClues(draft.clues));
    }

    private static String requireRosterName(String field, String value) {
        if (isBlank(value)) {
            throw new CaseGenerationException("Case is missing the " + field);
        }
        String name = SuspectRoster.canonicalName(value);
        if (name == null) {
            throw new CaseGenerationException("The " + field + " is not a resident: " + value);
        }
        return name;
    }

    private static Map<String, String> canonicalAlibis(Map<String, String> raw) {
        Map<String, String> alibis = new HashMap<>();
        if (raw == null) {
            return alibis;
        }
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String name = SuspectRoster.canonicalName(entry.getKey());
            if (name != null) {
                alibis.put(name, entry.getValue());
            }
        }
        return alibis;
    }

    private static List<Clue> validClues(List<CaseDraft.ClueDraft> drafts) {
        List<Clue> clues = new ArrayList<>();
        if (drafts == null) {
            logger.warn("⚠️ [CaseGenerator] Case came without clues");
            return clues;
        }
        for (CaseDraft.ClueDraft draft : drafts) {
            if (draft == null || isBlank(draft.clue)) {
                continue;
            }
            String owner = SuspectRoster.canonicalName(draft.knownBy);
            if (owner == null) {
                logger.warn("⚠️ [CaseGenerator] Dropping clue owned by unknown character '{}': {}", draft.knownBy, draft.clue);
                continue;
            }
            if (clues.size() == MAX_CLUES) {
                logger.warn("⚠️ [CaseGenerator] More than {} clues, dropping: {}", MAX_CLUES, draft.clue);
                continue;
            }
            clues.add(new Clue(draft.clue.trim(), owner, Boolean.TRUE.equals(draft.isTrue), draft.category));
        }
        return clues;
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
