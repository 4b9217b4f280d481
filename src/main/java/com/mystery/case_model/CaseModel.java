package com.mystery.case_model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The facts of one game. Immutable once built by {@link CaseGenerator}.
 */
public final class CaseModel {
    private final String victim;
    private final String murderer;
    private final String motive;
    private final String crimeLocation;
    private final String causeOfDeath;
    private final String timeOfDeath;
    private final Map<String, CaseCharacter> characters;
    private final RelationshipGraph relationships;
    private final List<Clue> clues;

    CaseModel(String victim, String murderer, String motive, String crimeLocation, String causeOfDeath,
              String timeOfDeath, Map<String, CaseCharacter> characters, RelationshipGraph relationships,
              List<Clue> clues) {
        this.victim = victim;
        this.murderer = murderer;
        this.motive = motive;
        this.crimeLocation = crimeLocation;
        this.causeOfDeath = causeOfDeath;
        this.timeOfDeath = timeOfDeath;
        this.characters = Collections.unmodifiableMap(new LinkedHashMap<>(characters));
        this.relationships = relationships;
        this.clues = List.copyOf(clues);
    }

    /**
     * Every roster character with role and alibi, in roster order
     */
    public Map<String, CaseCharacter> buildWorldState() {
        return characters;
    }

    /**
     * @throws IllegalArgumentException for a name that is not part of the case
     */
    public CaseCharacter getCharacter(String name) {
        CaseCharacter character = characters.get(name);
        if (character == null) {
            throw new IllegalArgumentException("Unknown character: " + name);
        }
        return character;
    }

    public boolean hasCharacter(String name) {
        return name != null && characters.containsKey(name);
    }

    /**
     * Characters who can still be interrogated
     */
    public List<String> getLivingNames() {
        List<String> living = new ArrayList<>();
        for (CaseCharacter character : characters.values()) {
            if (!character.isVictim()) {
                living.add(character.getName());
            }
        }
        return living;
    }

    public List<Clue> cluesOwnedBy(String name) {
        List<Clue> owned = new ArrayList<>();
        for (Clue clue : clues) {
            if (clue.getOwner().equals(name)) {
                owned.add(clue);
            }
        }
        return owned;
    }

    public String getVictim() { return victim; }
    public String getMurderer() { return murderer; }
    public String getMotive() { return motive; }
    public String getCrimeLocation() { return crimeLocation; }
    public String getCauseOfDeath() { return causeOfDeath; }
    public String getTimeOfDeath() { return timeOfDeath; }
    public Collection<CaseCharacter> getCharacters() { return characters.values(); }
    public RelationshipGraph getRelationships() { return relationships; }
    public List<Clue> getClues() { return clues; }
}
