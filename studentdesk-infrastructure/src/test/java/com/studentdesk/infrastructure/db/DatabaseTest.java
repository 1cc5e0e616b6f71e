package com.studentdesk.infrastructure.db;

import com.studentdesk.application.config.DatabaseSettings;
import com.studentdesk.application.error.StoreConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseTest {

    @TempDir
    Path tmp;

    @Test
    void pingSucceedsForReachableStore() {
        Database db = new Database(DatabaseSettings.forUrl("jdbc:sqlite:" + tmp.resolve("ok.db")));

        db.ping();
    }

    @Test
    void connectionsHaveAutoCommitOff() throws Exception {
        Database db = new Database(DatabaseSettings.forUrl("jdbc:sqlite:" + tmp.resolve("tx.db")));

        try (Connection c = db.getConnection()) {
            assertThat(c.getAutoCommit()).isFalse();
        }
    }

    @Test
    void unreachableStoreFailsWithConnectionError() {
        Path missingDir = tmp.resolve("no-such-dir").resolve("x.db");
        Database db = new Database(DatabaseSettings.forUrl("jdbc:sqlite:" + missingDir));

        assertThatThrownBy(db::ping).isInstanceOf(StoreConnectionException.class);
    }

    @Test
    void unknownDriverFailsWithConnectionError() {
        Database db = new Database(DatabaseSettings.forUrl("jdbc:nosuchdriver://localhost/x"));

        assertThatThrownBy(db::getConnection)
                .isInstanceOf(StoreConnectionException.class)
                .hasMessageContaining("No suitable driver");
    }

    @Test
    void initSchemaIsIdempotent() {
        Database db = new Database(DatabaseSettings.forUrl("jdbc:sqlite:" + tmp.resolve("schema.db")));

        db.initSchema();
        db.initSchema();

        assertThat(new JdbcStudentRepository(db).findAll()).isEmpty();
    }
}
