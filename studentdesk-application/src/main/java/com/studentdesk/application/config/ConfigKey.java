package com.studentdesk.application.config;

/**
 * Known configuration keys for StudentDesk.
 * Each key can be overridden by an environment variable, e.g. db.host -> STUDENTDESK_DB_HOST.
 */
public enum ConfigKey {
    DB_HOST("db.host", false, false),
    DB_PORT("db.port", false, false),
    DB_NAME("db.name", false, false),
    DB_USER("db.user", false, false),
    DB_PASSWORD("db.password", true, true),

    // full JDBC URL; when set, host/port/name are ignored
    DB_URL("db.url", false, true),
    DB_INIT_SCHEMA("db.initSchema", false, true);

    private final String key;
    private final boolean secret;
    private final boolean optional;

    ConfigKey(String key, boolean secret, boolean optional) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
}
