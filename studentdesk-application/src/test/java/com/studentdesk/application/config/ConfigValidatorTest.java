package com.studentdesk.application.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    private static MapConfig complete() {
        return new MapConfig()
                .with("db.host", "localhost")
                .with("db.port", "5432")
                .with("db.name", "students_db")
                .with("db.user", "postgres");
    }

    @Test
    void completeConfigIsValidWithoutPassword() {
        ConfigValidationResult res = validator.validate(complete());

        assertThat(res.isValid()).isTrue();
        assertThat(res.ok()).isTrue();
        assertThat(res.errors()).isEmpty();
    }

    @Test
    void missingKeysAreReported() {
        ConfigValidationResult res = validator.validate(new MapConfig().with("db.host", "localhost"));

        assertThat(res.isValid()).isFalse();
        assertThat(res.ok()).isFalse();
        assertThat(res.errors()).containsExactlyInAnyOrder(
                "Missing required config: db.port",
                "Missing required config: db.name",
                "Missing required config: db.user");
    }

    @Test
    void badPortIsReported() {
        assertThat(validator.validate(complete().with("db.port", "abc")).errors())
                .containsExactly("db.port must be a number: abc");
        assertThat(validator.validate(complete().with("db.port", "70000")).errors())
                .containsExactly("db.port must be between 1 and 65535: 70000");
    }

    @Test
    void urlOverrideSkipsHostChecks() {
        assertThat(validator.validate(new MapConfig().with("db.url", "jdbc:sqlite:students.db")).isValid()).isTrue();
        assertThat(validator.validate(new MapConfig().with("db.url", "postgres://x")).errors())
                .containsExactly("db.url must start with jdbc:");
    }
}
