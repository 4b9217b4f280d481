package com.mystery.ai_engine;

import com.mystery.case_model.CharacterRole;
import com.mystery.case_model.RelationshipType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one character knows, hides and is touchy about. Derived from the case alone, apart from the
 * optional hintable facts.
 */
public final class Briefing {
    private final String character;
    private final CharacterRole role;
    private final List<String> whatTheyKnow;
    private final List<String> whatTheyHide;
    private final Map<String, RelationshipType> relationshipsContext;
    private final List<String> likelyQuestions;
    private final List<String> defensiveTopics;
    private final List<String> hintableFacts;

    Briefing(String character, CharacterRole role, List<String> whatTheyKnow, List<String> whatTheyHide,
             Map<String, RelationshipType> relationshipsContext, List<String> likelyQuestions,
             List<String> defensiveTopics, List<String> hintableFacts) {
        this.character = character;
        this.role = role;
        this.whatTheyKnow = List.copyOf(whatTheyKnow);
        this.whatTheyHide = List.copyOf(whatTheyHide);
        this.relationshipsContext = Collections.unmodifiableMap(new LinkedHashMap<>(relationshipsContext));
        this.likelyQuestions = List.copyOf(likelyQuestions);
        this.defensiveTopics = List.copyOf(defensiveTopics);
        this.hintableFacts = List.copyOf(hintableFacts);
    }

    public String getCharacter() { return character; }
    public CharacterRole getRole() { return role; }
    public List<String> getWhatTheyKnow() { return whatTheyKnow; }
    public List<String> getWhatTheyHide() { return whatTheyHide; }
    public Map<String, RelationshipType> getRelationshipsContext() { return relationshipsContext; }
    public List<String> getLikelyQuestions() { return likelyQuestions; }
    public List<String> getDefensiveTopics() { return defensiveTopics; }

    /**
     * Empty until facts have been generated for this character
     */
    public List<String> getHintableFacts() { return hintableFacts; }
}
