package com.mystery.case_model;

import java.util.List;

/**
 * A character of the case: fixed demographics from the roster plus the role and alibi drawn for this game.
 */
public final class CaseCharacter {
    private final String name;
    private final int age;
    private final String gender;
    private final String occupation;
    private final List<String> flavourTraits;
    private final CharacterRole role;
    private final String alibi;

    public CaseCharacter(SuspectRoster.Profile profile, CharacterRole role, String alibi) {
        this.name = profile.getName();
        this.age = profile.getAge();
        this.gender = profile.getGender();
        this.occupation = profile.getOccupation();
        this.flavourTraits = profile.getTraits();
        this.role = role;
        this.alibi = alibi;
    }

    public String getName() {
        return name;
    }

    public int getAge() {
        return age;
    }

    public String getGender() {
        return gender;
    }

    public String getOccupation() {
        return occupation;
    }

    public List<String> getFlavourTraits() {
        return flavourTraits;
    }

    public CharacterRole getRole() {
        return role;
    }

    public String getAlibi() {
        return alibi;
    }

    public boolean isVictim() {
        return role == CharacterRole.VICTIM;
    }

    public boolean isMurderer() {
        return role == CharacterRole.MURDERER;
    }

    /**
     * "30 year old Male Lawyer"
     */
    public String describe() {
        return age + " year old " + gender + " " + occupation;
    }

    @Override
    public String toString() {
        return name + " (" + role.getValue() + ")";
    }
}
