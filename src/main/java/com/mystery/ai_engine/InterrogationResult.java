package com.mystery.ai_engine;

import com.mystery.game_state.Trait;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answer to one question together with what it did to the suspect
 */
public final class InterrogationResult {
    private final String character;
    private final String question;
    private final String answer;
    private final Map<Trait, Integer> traitDeltas;
    private final DisclosurePolicy disclosure;
    private final Map<String, Integer> personalityAfter;
    private final boolean fallback;

    public InterrogationResult(String character, String question, String answer, Map<Trait, Integer> traitDeltas,
                               DisclosurePolicy disclosure, Map<String, Integer> personalityAfter, boolean fallback) {
        this.character = character;
        this.question = question;
        this.answer = answer;
        this.traitDeltas = traitDeltas.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(traitDeltas));
        this.disclosure = disclosure;
        this.personalityAfter = Collections.unmodifiableMap(new LinkedHashMap<>(personalityAfter));
        this.fallback = fallback;
    }

    public String getCharacter() { return character; }
    public String getQuestion() { return question; }
    public String getAnswer() { return answer; }
    public Map<Trait, Integer> getTraitDeltas() { return traitDeltas; }

    /**
     * Disclosure band the answer was generated under
     */
    public DisclosurePolicy getDisclosure() { return disclosure; }
    public Map<String, Integer> getPersonalityAfter() { return personalityAfter; }

    /**
     * True when the service failed and the suspect answered with a fixed line
     */
    public boolean isFallback() { return fallback; }

    /**
     * Deltas keyed by trait label, for display
     */
    public Map<String, Integer> getTraitDeltasByLabel() {
        Map<String, Integer> labelled = new LinkedHashMap<>();
        for (Map.Entry<Trait, Integer> entry : traitDeltas.entrySet()) {
            labelled.put(entry.getKey().getLabel(), entry.getValue());
        }
        return labelled;
    }
}
