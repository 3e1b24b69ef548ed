package com.catalog.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(new Configuration()).isEmpty());
        assertDoesNotThrow(() -> validator.validateAndReport(new Configuration()));
    }

    @Test
    void testDirectoryTtlMustNotExceedFragmentTtl() {
        Configuration cfg = new Configuration();
        cfg.directoryTtlMinutes = 60;
        cfg.fragmentTtlMinutes = 30;

        List<ConfigValidator.ValidationError> errors = validator.validate(cfg);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).isError());
        assertThrows(IllegalStateException.class, () -> validator.validateAndReport(cfg));
    }

    @Test
    void testWarningsDoNotAbort() {
        Configuration cfg = new Configuration();
        cfg.parallelism = 100;
        cfg.storage = "redis";
        cfg.resolveCacheMinutes = 0;

        List<ConfigValidator.ValidationError> errors = validator.validate(cfg);

        assertEquals(3, errors.size());
        assertTrue(errors.stream().noneMatch(ConfigValidator.ValidationError::isError));
        assertDoesNotThrow(() -> validator.validateAndReport(cfg));
    }

    @Test
    void testInvalidNumbers() {
        Configuration cfg = new Configuration();
        cfg.parallelism = 0;
        cfg.decayFactor = 1.5;
        cfg.resolveTimeoutMs = 0;

        assertEquals(3, validator.validate(cfg).stream().filter(ConfigValidator.ValidationError::isError).count());
    }
}
