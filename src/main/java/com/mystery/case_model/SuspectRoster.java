package com.mystery.case_model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The six residents of the mansion. Demographics are the same in every game.
 */
public final class SuspectRoster {

    private static final Map<String, Profile> PROFILES = new LinkedHashMap<>();

    static {
        add(new Profile("Nick", 30, "Male", "Lawyer", List.of("Intelligent", "Ambitious", "Witty")));
        add(new Profile("Sarah", 28, "Female", "Artist", List.of("Creative", "Sensitive", "Observant")));
        add(new Profile("James", 35, "Male", "Chef", List.of("Charming", "Confident", "Jealous")));
        add(new Profile("Emma", 32, "Female", "Tech Worker", List.of("Logical", "Introverted", "Calculated")));
        add(new Profile("David", 29, "Male", "Writer", List.of("Observant", "Sarcastic", "Moody")));
        add(new Profile("Lisa", 31, "Female", "Musician", List.of("Expressive", "Emotional", "Loyal")));
    }

    private SuspectRoster() {
    }

    private static void add(Profile profile) {
        PROFILES.put(profile.getName(), profile);
    }

    public static List<String> names() {
        return List.copyOf(PROFILES.keySet());
    }

    public static List<Profile> profiles() {
        return List.copyOf(PROFILES.values());
    }

    public static boolean contains(String name) {
        return name != null && PROFILES.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException when the name is not on the roster
     */
    public static Profile get(String name) {
        Profile profile = name != null ? PROFILES.get(name) : null;
        if (profile == null) {
            throw new IllegalArgumentException("Not a resident of the mansion: " + name);
        }
        return profile;
    }

    /**
     * Roster name matching the given text ignoring case and surrounding whitespace, or null
     */
    public static String canonicalName(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        for (String name : PROFILES.keySet()) {
            if (name.equalsIgnoreCase(trimmed)) {
                return name;
            }
        }
        return null;
    }

    public static final class Profile {
        private final String name;
        private final int age;
        private final String gender;
        private final String occupation;
        private final List<String> traits;

        public Profile(String name, int age, String gender, String occupation, List<String> traits) {
            this.name = name;
            this.age = age;
            this.gender = gender;
            this.occupation = occupation;
            this.traits = Collections.unmodifiableList(traits);
        }

        public String getName() { return name; }
        public int getAge() { return age; }
        public String getGender() { return gender; }
        public String getOccupation() { return occupation; }
        public List<String> getTraits() { return traits; }
    }
}
