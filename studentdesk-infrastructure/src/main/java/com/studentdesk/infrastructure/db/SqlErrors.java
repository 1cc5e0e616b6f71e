package com.studentdesk.infrastructure.db;

import com.studentdesk.application.error.DuplicateEmailException;
import com.studentdesk.application.error.StoreConnectionException;
import com.studentdesk.application.error.StoreException;
import com.studentdesk.domain.DomainException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Maps driver exceptions onto the application error taxonomy.
 */
final class SqlErrors {

    private SqlErrors() {}

    static final String PG_UNIQUE_VIOLATION = "23505";

    static DomainException translate(SQLException e, String email) {
        if (isUniqueViolation(e)) return new DuplicateEmailException(email, e);
        if (isConnectionFailure(e)) return new StoreConnectionException(diagnostic(e), e);
        return new StoreException(diagnostic(e), e);
    }

    static boolean isUniqueViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (!(t instanceof SQLException se)) continue;

            if (PG_UNIQUE_VIOLATION.equals(se.getSQLState())) return true;

            if (se instanceof SQLiteException sqlite) {
                SQLiteErrorCode code = sqlite.getResultCode();
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) return true;
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT
                        && String.valueOf(se.getMessage()).contains("UNIQUE")) return true;
            }
        }
        return false;
    }

    // SQLState class 08 = connection exception
    static boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    static String diagnostic(SQLException e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m.trim();
    }
}
