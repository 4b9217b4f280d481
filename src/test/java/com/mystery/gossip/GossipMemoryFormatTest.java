package com.mystery.gossip;

import com.mystery.case_model.RelationshipType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GossipMemoryFormatTest {

    private final List<GossipEntry> heard = List.of(
        new GossipEntry("Lisa", "The detective kept asking about the cellar.", RelationshipType.ENEMY),
        new GossipEntry("Sarah", "They think someone poisoned the wine.", RelationshipType.CLOSE_FRIEND),
        new GossipEntry("Lisa", "I told them nothing, of course.", RelationshipType.ENEMY));

    @Test
    public void entriesAreGroupedBySourceInFirstHeardOrder() {
        String text = GossipMemoryFormat.format("Nick", heard);

        assertTrue(text.startsWith("Gossip accumulated by Nick:\n\n"));
        assertTrue(text.contains("From Lisa (Enemy):\n  1. The detective kept asking about the cellar.\n  2. I told them nothing, of course.\n"));
        assertTrue(text.contains("From Sarah (Close Friend):\n  1. They think someone poisoned the wine.\n"));
        assertTrue(text.indexOf("From Lisa") < text.indexOf("From Sarah"));
    }

    @Test
    public void digestNamesSourcesAndLatestEntry() {
        String digest = GossipMemoryFormat.digest("Nick", heard);

        assertEquals("Nick has heard 3 pieces of gossip from Lisa, Sarah. "
            + "Latest from Lisa (Enemy): \"I told them nothing, of course.\"", digest);
        assertEquals("Nick has not heard any gossip.", GossipMemoryFormat.digest("Nick", List.of()));
    }

    @Test
    public void inMemoryStoreKeepsOnlyTheLatestVersion() {
        InMemoryGossipMemoryService memory = new InMemoryGossipMemoryService("mystery-42");

        assertTrue(memory.summarize("Nick").isEmpty());
        String first = memory.store("Nick", heard.subList(0, 1));
        String second = memory.store("Nick", heard);

        assertEquals("mystery-42-1", first);
        assertEquals("mystery-42-2", second);
        MemorySummary summary = memory.summarize("Nick").orElseThrow();
        assertEquals(second, summary.getHandle());
        assertTrue(summary.getSummaryText().orElseThrow().startsWith("Nick has heard 3 pieces"));
        assertTrue(memory.getStoredText("Nick").orElseThrow().contains("I told them nothing"));
        assertTrue(memory.getStoredText("James").isEmpty());
    }

    @Test
    public void blankSummaryCountsAsNone() {
        assertTrue(new MemorySummary("h", "  ").getSummaryText().isEmpty());
        assertTrue(new MemorySummary("h", null).getSummaryText().isEmpty());
    }
}
