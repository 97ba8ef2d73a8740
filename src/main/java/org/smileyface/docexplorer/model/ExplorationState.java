package org.smileyface.docexplorer.model;

/**
 * Lifecycle state of one top-level exploration request.
 */
public enum ExplorationState {
    IDLE,
    EXPLORING,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
