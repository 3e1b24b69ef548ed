package com.catalog.core.aggregation;

import com.catalog.common.model.SourceFailure;
import com.catalog.core.CatalogException;

import java.util.List;

/** Every enabled source failed in one cycle (or none was enabled). */
public class AggregationFailedException extends CatalogException {
    private final List<SourceFailure> failures;

    public AggregationFailedException(String message, List<SourceFailure> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }
}
