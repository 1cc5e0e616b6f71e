package com.studentdesk.application.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseSettingsTest {

    @Test
    void buildsPostgresUrlFromParts() {
        DatabaseSettings s = DatabaseSettings.from(new MapConfig()
                .with("db.host", "db.internal")
                .with("db.port", "6543")
                .with("db.name", "students_db")
                .with("db.user", "app")
                .with("db.password", "s3cret"));

        assertThat(s.jdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:6543/students_db");
        assertThat(s.isSqlite()).isFalse();
        assertThat(s.initSchema()).isFalse();
        assertThat(s.toString()).doesNotContain("s3cret");
    }

    @Test
    void urlOverrideWins() {
        DatabaseSettings s = DatabaseSettings.from(new MapConfig()
                .with("db.host", "ignored")
                .with("db.url", " jdbc:sqlite:/tmp/students.db ")
                .with("db.initSchema", "true"));

        assertThat(s.jdbcUrl()).isEqualTo("jdbc:sqlite:/tmp/students.db");
        assertThat(s.isSqlite()).isTrue();
        assertThat(s.initSchema()).isTrue();
    }
}
