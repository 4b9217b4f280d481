package com.mystery.gossip;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text forms of a character's accumulated gossip
 */
public final class GossipMemoryFormat {

    private GossipMemoryFormat() {
    }

    /**
     * Full text kept in the memory store, grouped by who told it:
     * <pre>
     * Gossip accumulated by Lisa:
     *
     * From Nick (Enemy):
     *   1. ...
     * </pre>
     */
    public static String format(String character, List<GossipEntry> entries) {
        StringBuilder formatted = new StringBuilder("Gossip accumulated by ").append(character).append(":\n\n");
        for (Map.Entry<String, List<GossipEntry>> group : bySource(entries).entrySet()) {
            formatted.append("From ").append(group.getKey())
                .append(" (").append(group.getValue().get(0).getRelationship().getLabel()).append("):\n");
            int index = 1;
            for (GossipEntry entry : group.getValue()) {
                formatted.append("  ").append(index++).append(". ").append(entry.getText()).append('\n');
            }
            formatted.append('\n');
        }
        return formatted.toString();
    }

    /**
     * One-paragraph summary used by the stores that cannot summarize on their own
     */
    public static String digest(String character, List<GossipEntry> entries) {
        if (entries.isEmpty()) {
            return character + " has not heard any gossip.";
        }
        GossipEntry latest = entries.get(entries.size() - 1);
        return String.format("%s has heard %d piece%s of gossip from %s. Latest from %s (%s): \"%s\"",
            character, entries.size(), entries.size() == 1 ? "" : "s",
            String.join(", ", bySource(entries).keySet()),
            latest.getSource(), latest.getRelationship().getLabel(), latest.getText());
    }

    private static Map<String, List<GossipEntry>> bySource(List<GossipEntry> entries) {
        Map<String, List<GossipEntry>> grouped = new LinkedHashMap<>();
        for (GossipEntry entry : entries) {
            grouped.computeIfAbsent(entry.getSource(), source -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }
}
