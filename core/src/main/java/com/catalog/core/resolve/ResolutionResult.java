package com.catalog.core.resolve;

import com.catalog.common.model.ResolvedStream;

import java.util.List;
import java.util.Optional;

public final class ResolutionResult {
    private final String entryKey;
    private final ResolutionState state;
    private final List<ResolutionAttempt> attempts;
    private final ResolvedStream stream;

    public ResolutionResult(String entryKey, ResolutionState state, List<ResolutionAttempt> attempts, ResolvedStream stream) {
        if (!state.isTerminal()) throw new IllegalArgumentException("Result needs a terminal state, got " + state);
        if (state == ResolutionState.SUCCEEDED && stream == null) {
            throw new IllegalArgumentException("SUCCEEDED without stream");
        }
        this.entryKey = entryKey;
        this.state = state;
        this.attempts = List.copyOf(attempts);
        this.stream = stream;
    }

    public String getEntryKey() { return entryKey; }
    public ResolutionState getState() { return state; }
    public List<ResolutionAttempt> getAttempts() { return attempts; }

    public Optional<ResolvedStream> getStream() {
        return Optional.ofNullable(stream);
    }

    public boolean isSuccess() {
        return state == ResolutionState.SUCCEEDED;
    }

    /** Plugin id that produced the stream, if any. */
    public Optional<String> getResolvedBy() {
        return attempts.stream().filter(ResolutionAttempt::isSuccess).map(ResolutionAttempt::pluginId).findFirst();
    }

    @Override
    public String toString() {
        return "ResolutionResult[" + entryKey + " " + state + " attempts=" + attempts.size() + "]";
    }
}
