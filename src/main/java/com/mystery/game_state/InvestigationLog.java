package com.mystery.game_state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The detective's notebook: short observations per interviewed character
 */
public class InvestigationLog {
    public static final String PENDING = "(generating...)";
    public static final String FAILED = "(Unable to generate snippet)";

    private final Map<String, List<String>> snippets = new LinkedHashMap<>();

    /**
     * Marks that the character has been spoken to, so the log shows an entry even before the first snippet arrives
     */
    public synchronized void recordExchange(String character) {
        snippets.computeIfAbsent(character, name -> new ArrayList<>());
    }

    public synchronized void addSnippet(String character, String snippet) {
        snippets.computeIfAbsent(character, name -> new ArrayList<>()).add(snippet);
    }

    /**
     * Characters in order of first interview, each with distinct snippets in arrival order
     */
    public synchronized Map<String, List<String>> view() {
        Map<String, List<String>> view = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : snippets.entrySet()) {
            List<String> unique = new ArrayList<>(new LinkedHashSet<>(entry.getValue()));
            if (unique.isEmpty()) {
                unique.add(PENDING);
            }
            view.put(entry.getKey(), unique);
        }
        return view;
    }

    public synchronized boolean isEmpty() {
        return snippets.isEmpty();
    }
}
