package com.mystery.service;

import com.mystery.gossip.GossipMemoryProvider;
import com.mystery.gossip.GossipMemoryService;
import com.mystery.repository.GossipMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Database-backed gossip memory, one collection per game session
 */
@Service
public class GossipMemoryStore implements GossipMemoryProvider {
    private static final Logger logger = LoggerFactory.getLogger(GossipMemoryStore.class);

    @Autowired
    private GossipMemoryRepository gossipMemoryRepository;

    @Override
    public GossipMemoryService open(String collectionId) {
        logger.info("🎮 [GossipMemory] Opening collection {}", collectionId);
        return new JpaGossipMemoryService(gossipMemoryRepository, collectionId);
    }
}
