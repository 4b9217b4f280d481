package com.mystery.case_model;

/**
 * Role of a character in one case. Exactly one victim and one murderer per game.
 */
public enum CharacterRole {
    VICTIM("victim"),
    MURDERER("murderer"),
    INNOCENT("innocent_suspect");

    private final String value;

    CharacterRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
