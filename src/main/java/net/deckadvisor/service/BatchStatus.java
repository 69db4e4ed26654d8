package net.deckadvisor.service;

/**
 * Lifecycle of an incremental recommendation session. {@link #EXHAUSTED} is terminal until reset.
 */
public enum BatchStatus {
    ACTIVE,
    EXHAUSTED
}
