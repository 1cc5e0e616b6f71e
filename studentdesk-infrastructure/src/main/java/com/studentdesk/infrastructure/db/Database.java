package com.studentdesk.infrastructure.db;

import com.studentdesk.application.config.DatabaseSettings;
import com.studentdesk.application.error.StoreConnectionException;
import com.studentdesk.application.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection provider. One new connection per call, no pooling, no retry.
 * Connections come back with auto-commit off; callers commit explicitly.
 */
public final class Database {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final DatabaseSettings settings;

    public Database(DatabaseSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DatabaseSettings settings() {
        return settings;
    }

    public Connection getConnection() {
        String url = settings.jdbcUrl();
        Connection c;
        try {
            c = DriverManager.getConnection(url, connectionProperties());
        } catch (SQLException e) {
            log.warn("Failed to connect to {}: {}", url, e.getMessage());
            throw new StoreConnectionException(SqlErrors.diagnostic(e), e);
        }

        try {
            c.setAutoCommit(false);
            return c;
        } catch (SQLException e) {
            closeQuietly(c);
            throw new StoreConnectionException(SqlErrors.diagnostic(e), e);
        }
    }

    /** Opens and closes one connection; fails with {@link StoreConnectionException}. */
    public void ping() {
        try (Connection c = getConnection()) {
            log.info("Connected to {}", settings.jdbcUrl());
        } catch (SQLException e) {
            throw new StoreConnectionException(SqlErrors.diagnostic(e), e);
        }
    }

    /** Creates the students table if it is missing. */
    public void initSchema() {
        String script = loadSchemaScript();

        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) st.execute(sql.trim());
            }
            c.commit();
            log.info("Schema ready ({})", schemaResource());
        } catch (SQLException e) {
            throw new StoreException(SqlErrors.diagnostic(e), e);
        }
    }

    private Properties connectionProperties() {
        Properties p = new Properties();
        if (settings.user() != null && !settings.user().isBlank()) p.setProperty("user", settings.user());
        if (settings.password() != null) p.setProperty("password", settings.password());
        return p;
    }

    private String schemaResource() {
        return settings.isSqlite() ? "/db/schema-sqlite.sql" : "/db/schema-postgresql.sql";
    }

    private String loadSchemaScript() {
        String resource = schemaResource();
        try (InputStream in = Database.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Missing schema resource: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + resource, e);
        }
    }

    private static void closeQuietly(Connection c) {
        try {
            c.close();
        } catch (SQLException e) {
            log.debug("Ignoring close failure", e);
        }
    }
}
