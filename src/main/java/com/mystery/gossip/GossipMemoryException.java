package com.mystery.gossip;

/**
 * A store or summarize call to the gossip memory failed
 */
public class GossipMemoryException extends RuntimeException {

    public GossipMemoryException(String message) {
        super(message);
    }

    public GossipMemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
