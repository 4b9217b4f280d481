package com.mystery.case_model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Undirected, complete labelling of every pair of characters. Built once and never mutated.
 */
public final class RelationshipGraph {
    private final List<String> names;
    private final Map<String, RelationshipType> edges;

    private RelationshipGraph(List<String> names, Map<String, RelationshipType> edges) {
        this.names = List.copyOf(names);
        this.edges = Collections.unmodifiableMap(edges);
    }

    /**
     * Builds the graph from raw pair keys ("Nick_Sarah") to labels.
     * Either key order is accepted; a pair given twice must carry the same label.
     *
     * @throws CaseGenerationException when a key names someone off the roster, a label is unknown,
     *                                 two labels conflict or any pair is left unlabelled
     */
    public static RelationshipGraph fromPairs(List<String> names, Map<String, String> rawPairs) {
        if (rawPairs == null || rawPairs.isEmpty()) {
            throw new CaseGenerationException("Case has no relationships");
        }
        Map<String, RelationshipType> edges = new HashMap<>();
        for (Map.Entry<String, String> entry : rawPairs.entrySet()) {
            String[] parts = entry.getKey().split("_");
            if (parts.length != 2) {
                throw new CaseGenerationException("Malformed relationship key: " + entry.getKey());
            }
            String a = canonical(names, parts[0]);
            String b = canonical(names, parts[1]);
            if (a == null || b == null) {
                throw new CaseGenerationException("Relationship names someone outside the roster: " + entry.getKey());
            }
            if (a.equals(b)) {
                throw new CaseGenerationException("Relationship of a character with itself: " + entry.getKey());
            }
            RelationshipType type;
            try {
                type = RelationshipType.fromLabel(entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new CaseGenerationException("Invalid label for " + entry.getKey() + ": " + e.getMessage(), e);
            }
            String key = key(a, b);
            RelationshipType previous = edges.putIfAbsent(key, type);
            if (previous != null && previous != type) {
                throw new CaseGenerationException("Conflicting labels for " + a + " and " + b + ": "
                    + previous.getLabel() + " vs " + type.getLabel());
            }
        }

        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                if (!edges.containsKey(key(names.get(i), names.get(j)))) {
                    throw new CaseGenerationException("Missing relationship between "
                        + names.get(i) + " and " + names.get(j));
                }
            }
        }
        return new RelationshipGraph(names, edges);
    }

    /**
     * @throws IllegalArgumentException for a name off the graph or a character paired with itself
     */
    public RelationshipType between(String a, String b) {
        if (a != null && a.equals(b)) {
            throw new IllegalArgumentException("No relationship of " + a + " with itself");
        }
        RelationshipType type = edges.get(key(a, b));
        if (type == null) {
            throw new IllegalArgumentException("Unknown pair: " + a + ", " + b);
        }
        return type;
    }

    /**
     * Everyone else with their label towards the given character, in roster order
     */
    public Map<String, RelationshipType> relationsOf(String name) {
        Map<String, RelationshipType> relations = new LinkedHashMap<>();
        for (String other : names) {
            if (!other.equals(name)) {
                relations.put(other, between(name, other));
            }
        }
        return relations;
    }

    public List<String> namesWith(String name, RelationshipType type) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, RelationshipType> entry : relationsOf(name).entrySet()) {
            if (entry.getValue() == type) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public boolean hasAny(RelationshipType type) {
        return edges.containsValue(type);
    }

    /**
     * Pairs in roster order as "A_B" keys
     */
    public Map<String, RelationshipType> asPairs() {
        Map<String, RelationshipType> pairs = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                pairs.put(names.get(i) + "_" + names.get(j), between(names.get(i), names.get(j)));
            }
        }
        return pairs;
    }

    public int size() {
        return edges.size();
    }

    private static String canonical(List<String> names, String raw) {
        String trimmed = raw.trim();
        for (String name : names) {
            if (name.equalsIgnoreCase(trimmed)) {
                return name;
            }
        }
        return null;
    }

    private static String key(String a, String b) {
        return a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a;
    }
}
