package com.studentdesk.application.config;

import com.studentdesk.application.ports.ConfigPort;

/**
 * Connection settings handed to the connection provider at start-up.
 *
 * @param url explicit JDBC URL, or null to build a PostgreSQL URL from host/port/name
 */
public record DatabaseSettings(
        String host,
        int port,
        String name,
        String user,
        String password,
        String url,
        boolean initSchema
) {

    public static final int DEFAULT_PORT = 5432;

    public static DatabaseSettings from(ConfigPort config) {
        String url = config.get(ConfigKey.DB_URL.key(), "");
        return new DatabaseSettings(
                config.get(ConfigKey.DB_HOST.key(), "localhost").trim(),
                config.getInt(ConfigKey.DB_PORT.key(), DEFAULT_PORT),
                config.get(ConfigKey.DB_NAME.key(), "").trim(),
                config.get(ConfigKey.DB_USER.key(), "").trim(),
                config.getSecret(ConfigKey.DB_PASSWORD.key()),
                url.isBlank() ? null : url.trim(),
                config.getBoolean(ConfigKey.DB_INIT_SCHEMA.key(), false)
        );
    }

    public static DatabaseSettings forUrl(String url) {
        return new DatabaseSettings(null, DEFAULT_PORT, null, null, null, url, false);
    }

    public DatabaseSettings withInitSchema(boolean value) {
        return new DatabaseSettings(host, port, name, user, password, url, value);
    }

    public String jdbcUrl() {
        if (url != null) return url;
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    public boolean isSqlite() {
        return jdbcUrl().startsWith("jdbc:sqlite:");
    }

    @Override
    public String toString() {
        return "DatabaseSettings[url=" + jdbcUrl() + ", user=" + user
                + ", password=" + (password == null || password.isEmpty() ? "<none>" : "****")
                + ", initSchema=" + initSchema + "]";
    }
}
