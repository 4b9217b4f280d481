package com.mystery.gossip;

/**
 * Stages one gossip fan-out goes through
 */
public enum PropagationStage {
    IDLE,
    SELECTING_RECIPIENTS,
    RELAYING,
    REACTING,
    APPLYING_EFFECTS,
    PERSISTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
