package com.catalog.core.resolve;

public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    /** Plugin ran but returned nothing for the entry. */
    NO_MATCH,
    ERROR,
    /** Stream came from the result cache, the plugin was not called. */
    CACHED
}
