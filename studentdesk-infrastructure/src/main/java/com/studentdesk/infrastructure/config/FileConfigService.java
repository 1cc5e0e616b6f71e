package com.studentdesk.infrastructure.config;

import com.studentdesk.application.config.ConfigKey;
import com.studentdesk.application.ports.ConfigPort;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration for StudentDesk.
 *
 * Load order (low -> high priority):
 *  1) classpath studentdesk-defaults.properties
 *  2) config/config.properties (optional)
 *  3) config/.env (optional)
 *  4) OS environment variables (highest priority)
 *
 * Env mapping: db.host -> STUDENTDESK_DB_HOST, db.initSchema -> STUDENTDESK_DB_INIT_SCHEMA.
 */
public final class FileConfigService implements ConfigPort {

    static final String DEFAULTS_RESOURCE = "/studentdesk-defaults.properties";
    static final String ENV_PREFIX = "STUDENTDESK_";

    private final Properties props = new Properties();
    private final Path configDir;

    private FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadDefaults();
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        Path base = Path.of(System.getProperty("user.dir")).resolve("config");
        return new FileConfigService(base, System.getenv());
    }

    public static FileConfigService fromDirectory(Path configDir, Map<String, String> env) throws IOException {
        return new FileConfigService(configDir, env);
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadDefaults() throws IOException {
        try (InputStream in = FileConfigService.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) props.load(in);
        }
    }

    private void loadAll() throws IOException {
        if (configDir == null) return;

        loadPropsIfExists(configDir.resolve("config.properties"));

        Map<String, String> env = DotEnv.loadIfExists(configDir.resolve(".env"));
        for (Map.Entry<String, String> e : env.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (!Files.exists(file)) return;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey k : ConfigKey.values()) {
            keys.add(k.key());
        }

        for (String key : keys) {
            String val = env.get(toEnvKey(key));
            if (val != null) props.setProperty(key, val);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - db.host       -> STUDENTDESK_DB_HOST
     * - db.initSchema -> STUDENTDESK_DB_INIT_SCHEMA
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return ENV_PREFIX + s.toUpperCase();
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    @Override
    public String getSecret(String key) {
        return props.getProperty(key);
    }
}
