package com.mystery.gossip;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local gossip memory for one session
 */
public class InMemoryGossipMemoryService implements GossipMemoryService {
    private final String collectionId;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, MemorySummary> latest = new ConcurrentHashMap<>();
    private final Map<String, String> storedText = new ConcurrentHashMap<>();

    public InMemoryGossipMemoryService(String collectionId) {
        this.collectionId = collectionId;
    }

    @Override
    public String store(String character, List<GossipEntry> entries) {
        String handle = collectionId + "-" + sequence.incrementAndGet();
        storedText.put(character, GossipMemoryFormat.format(character, entries));
        latest.put(character, new MemorySummary(handle, GossipMemoryFormat.digest(character, entries)));
        return handle;
    }

    @Override
    public Optional<MemorySummary> summarize(String character) {
        return Optional.ofNullable(latest.get(character));
    }

    /**
     * Full text last stored for the character
     */
    public Optional<String> getStoredText(String character) {
        return Optional.ofNullable(storedText.get(character));
    }
}
