package com.mystery.case_model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * Wire shape of a drawn case. Only ever read by {@link CaseGenerator}, which validates it into a {@link CaseModel}.
 */
class CaseDraft {
    String victim;
    String murderer;

    @SerializedName("murderer_motive")
    String murdererMotive;

    @SerializedName("crime_location")
    String crimeLocation;

    @SerializedName("cause_of_death")
    String causeOfDeath;

    @SerializedName("time_of_death")
    String timeOfDeath;

    Map<String, String> alibis;
    Map<String, String> relationships;
    List<ClueDraft> clues;

    static class ClueDraft {
        String clue;

        @SerializedName("known_by")
        String knownBy;

        @SerializedName("is_true")
        Boolean isTrue;

        String category;
    }
}
