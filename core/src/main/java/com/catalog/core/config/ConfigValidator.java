package com.catalog.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates configuration on startup so bad values fail fast instead of
 * surfacing as odd aggregation behaviour later.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        public boolean isError() {
            return "ERROR".equals(severity);
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateAggregation(config, errors);
        validateScoring(config, errors);
        validateCache(config, errors);
        validateStorage(config, errors);

        return errors;
    }

    private void validateAggregation(Configuration config, List<ValidationError> errors) {
        if (config.parallelism < 1) {
            errors.add(new ValidationError("parallelism must be at least 1, got " + config.parallelism, "ERROR"));
        } else if (config.parallelism > 64) {
            errors.add(new ValidationError("parallelism " + config.parallelism + " is unusually high", "WARNING"));
        }
        if (config.fetchTimeoutMs <= 0) {
            errors.add(new ValidationError("fetchTimeoutMs must be positive", "ERROR"));
        }
        if (config.resolveTimeoutMs <= 0) {
            errors.add(new ValidationError("resolveTimeoutMs must be positive", "ERROR"));
        }
        if (config.resolveCacheMinutes <= 0) {
            errors.add(new ValidationError("resolveCacheMinutes <= 0 turns the resolution cache off", "WARNING"));
        }
        if (config.failureThreshold < 1) {
            errors.add(new ValidationError("failureThreshold must be at least 1", "ERROR"));
        }
    }

    private void validateScoring(Configuration config, List<ValidationError> errors) {
        if (config.historyWindow < 1) {
            errors.add(new ValidationError("historyWindow must be at least 1", "ERROR"));
        }
        if (config.decayFactor <= 0 || config.decayFactor > 1) {
            errors.add(new ValidationError("decayFactor must be in (0, 1], got " + config.decayFactor, "ERROR"));
        }
        if (config.stalenessThresholdDays < 1) {
            errors.add(new ValidationError("stalenessThresholdDays must be at least 1", "ERROR"));
        }
        if (config.minQuality < 0 || config.minQuality > 1) {
            errors.add(new ValidationError("minQuality must be in [0, 1]", "WARNING"));
        }
    }

    private void validateCache(Configuration config, List<ValidationError> errors) {
        if (config.directoryTtlMinutes <= 0 || config.fragmentTtlMinutes <= 0) {
            errors.add(new ValidationError("Cache TTLs must be positive", "ERROR"));
        } else if (config.directoryTtlMinutes > config.fragmentTtlMinutes) {
            errors.add(new ValidationError(String.format(
                    "directoryTtlMinutes (%d) must not exceed fragmentTtlMinutes (%d)",
                    config.directoryTtlMinutes, config.fragmentTtlMinutes), "ERROR"));
        }
    }

    private void validateStorage(Configuration config, List<ValidationError> errors) {
        if (!"file".equalsIgnoreCase(config.storage) && !"h2".equalsIgnoreCase(config.storage)) {
            errors.add(new ValidationError("Unknown storage '" + config.storage + "', falling back to file", "WARNING"));
        }
        if ("h2".equalsIgnoreCase(config.storage) && (config.databasePath == null || config.databasePath.isBlank())) {
            errors.add(new ValidationError("storage=h2 requires databasePath", "ERROR"));
        }
    }

    /**
     * Validate and report to the log.
     * Throws IllegalStateException if critical errors were found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.isError()) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
