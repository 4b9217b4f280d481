package com.mystery.game_state;

import java.util.List;

/**
 * What the detective knows about the crime itself
 */
public final class FactsSheet {
    private final String victim;
    private final String crimeLocation;
    private final String causeOfDeath;
    private final String timeOfDeath;
    private final List<ClueLine> clues;

    public FactsSheet(String victim, String crimeLocation, String causeOfDeath, String timeOfDeath, List<ClueLine> clues) {
        this.victim = victim;
        this.crimeLocation = crimeLocation;
        this.causeOfDeath = causeOfDeath;
        this.timeOfDeath = timeOfDeath;
        this.clues = List.copyOf(clues);
    }

    public String getVictim() { return victim; }
    public String getCrimeLocation() { return crimeLocation; }
    public String getCauseOfDeath() { return causeOfDeath; }
    public String getTimeOfDeath() { return timeOfDeath; }
    public List<ClueLine> getClues() { return clues; }

    public static final class ClueLine {
        private final String text;
        private final boolean revealed;

        public ClueLine(String text, boolean revealed) {
            this.text = text;
            this.revealed = revealed;
        }

        public String getText() { return text; }

        /**
         * True once some suspect has given the clue away
         */
        public boolean isRevealed() { return revealed; }
    }
}
