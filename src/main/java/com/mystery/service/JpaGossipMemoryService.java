package com.mystery.service;

import com.mystery.entity.GossipMemory;
import com.mystery.gossip.GossipEntry;
import com.mystery.gossip.GossipMemoryException;
import com.mystery.gossip.GossipMemoryFormat;
import com.mystery.gossip.GossipMemoryService;
import com.mystery.gossip.MemorySummary;
import com.mystery.repository.GossipMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.Optional;

/**
 * Gossip memory of one session kept in the application database
 */
public class JpaGossipMemoryService implements GossipMemoryService {
    private static final Logger logger = LoggerFactory.getLogger(JpaGossipMemoryService.class);

    private final GossipMemoryRepository repository;
    private final String collectionId;

    public JpaGossipMemoryService(GossipMemoryRepository repository, String collectionId) {
        this.repository = repository;
        this.collectionId = collectionId;
    }

    @Override
    public String store(String character, List<GossipEntry> entries) {
        if (entries.isEmpty()) {
            throw new GossipMemoryException("Nothing to store for " + character);
        }
        GossipMemory memory = new GossipMemory(collectionId, character, entries.size(),
            GossipMemoryFormat.format(character, entries), GossipMemoryFormat.digest(character, entries));
        try {
            GossipMemory saved = repository.save(memory);
            String handle = collectionId + "-" + saved.getId();
            logger.debug("[GossipMemory] Stored {} piece(s) of gossip for {} as {}", entries.size(), character, handle);
            return handle;
        } catch (DataAccessException e) {
            throw new GossipMemoryException("Could not store gossip for " + character + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<MemorySummary> summarize(String character) {
        try {
            return repository.findFirstByCollectionIdAndCharacterNameOrderByIdDesc(collectionId, character)
                .map(memory -> new MemorySummary(collectionId + "-" + memory.getId(), memory.getSummaryText()));
        } catch (DataAccessException e) {
            throw new GossipMemoryException("Could not read gossip for " + character + ": " + e.getMessage(), e);
        }
    }

    public String getCollectionId() {
        return collectionId;
    }
}
