package com.mystery.gossip;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the gossip each character has accumulated during one game session.
 * Calls may fail with {@link GossipMemoryException}.
 */
public interface GossipMemoryService {

    /**
     * Stores the full list heard so far by the character
     *
     * @return handle of the stored memory
     */
    String store(String character, List<GossipEntry> entries);

    /**
     * Empty when nothing was stored for the character yet
     */
    Optional<MemorySummary> summarize(String character);
}
