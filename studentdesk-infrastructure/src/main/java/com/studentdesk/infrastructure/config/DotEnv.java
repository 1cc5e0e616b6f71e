package com.studentdesk.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal .env loader:
 * KEY=value or export KEY=value
 * Lines starting with # are comments.
 * Empty lines and lines without a key are ignored.
 */
public final class DotEnv {

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        Map<String, String> map = new LinkedHashMap<>();
        if (envFile == null || !Files.exists(envFile)) return map;

        for (String line : Files.readAllLines(envFile, StandardCharsets.UTF_8)) {
            Map.Entry<String, String> e = parseLine(line);
            if (e != null) map.put(e.getKey(), e.getValue());
        }
        return map;
    }

    static Map.Entry<String, String> parseLine(String line) {
        String t = line.trim();
        if (t.isEmpty() || t.startsWith("#")) return null;
        if (t.startsWith("export ")) t = t.substring("export ".length()).trim();

        int eq = t.indexOf('=');
        if (eq <= 0) return null;

        String key = t.substring(0, eq).trim();
        String val = t.substring(eq + 1).trim();

        if (val.length() >= 2
                && ((val.startsWith("\"") && val.endsWith("\"")) || (val.startsWith("'") && val.endsWith("'")))) {
            val = val.substring(1, val.length() - 1);
        }
        return Map.entry(key, val);
    }
}
