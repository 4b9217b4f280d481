package com.mystery.gossip;

/**
 * Opens the gossip memory of one game session
 */
public interface GossipMemoryProvider {

    GossipMemoryService open(String collectionId);
}
