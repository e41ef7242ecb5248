package eu.virtualparadox.companion.chat;

/**
 * Stages of one chat exchange. {@code RETRIEVING} is skipped when no documents are selected;
 * {@code FINALIZING} always runs once generation has started.
 */
public enum EChatState {
    PENDING,
    RETRIEVING,
    GENERATING,
    FINALIZING,
    DONE,
    FAILED
}
