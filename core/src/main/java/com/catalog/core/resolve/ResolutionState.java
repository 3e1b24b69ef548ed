package com.catalog.core.resolve;

/**
 * PENDING -> ATTEMPTING -> SUCCEEDED | EXHAUSTED | CANCELLED.
 * Only the last three are terminal and appear on a {@link ResolutionResult}.
 */
public enum ResolutionState {
    PENDING,
    ATTEMPTING,
    SUCCEEDED,
    EXHAUSTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED || this == CANCELLED;
    }
}
