package com.catalog.core.resolve;

/**
 * One plugin's turn in a resolution. {@code tries} is 2 when the first call timed out and
 * the plugin was called again; outcome and message then describe the second call. A
 * {@link AttemptOutcome#CACHED} attempt has zero tries.
 */
public record ResolutionAttempt(String pluginId, AttemptOutcome outcome, long elapsedMs, int tries, String message) {
    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS || outcome == AttemptOutcome.CACHED;
    }
}
