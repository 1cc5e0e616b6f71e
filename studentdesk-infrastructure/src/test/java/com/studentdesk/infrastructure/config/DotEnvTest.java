package com.studentdesk.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DotEnvTest {

    @TempDir
    Path tmp;

    @Test
    void missingFileGivesEmptyMap() throws Exception {
        assertThat(DotEnv.loadIfExists(tmp.resolve(".env"))).isEmpty();
    }

    @Test
    void parsesCommentsQuotesAndExport() throws Exception {
        Path f = tmp.resolve(".env");
        Files.writeString(f, String.join("\n",
                "# local postgres",
                "",
                "db.host=db.local",
                "export db.user = app",
                "db.password=\"p=ss word\"",
                "db.name='students'",
                "=novalue",
                "garbage"));

        Map<String, String> env = DotEnv.loadIfExists(f);

        assertThat(env).containsExactly(
                Map.entry("db.host", "db.local"),
                Map.entry("db.user", "app"),
                Map.entry("db.password", "p=ss word"),
                Map.entry("db.name", "students"));
    }
}
