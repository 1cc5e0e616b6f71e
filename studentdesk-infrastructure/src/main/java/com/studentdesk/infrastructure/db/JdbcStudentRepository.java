package com.studentdesk.infrastructure.db;

import com.studentdesk.application.ports.StudentRepository;
import com.studentdesk.domain.student.NewStudent;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link StudentRepository} over plain JDBC.
 *
 * Each call opens its own connection and closes it before returning.
 * A mutation is committed only if it touched a row; otherwise it is rolled back.
 */
public final class JdbcStudentRepository implements StudentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcStudentRepository.class);

    private static final String SELECT_ALL = """
            SELECT student_id, first_name, last_name, email, enrollment_date
            FROM students
            ORDER BY student_id
            """;

    private static final String INSERT = """
            INSERT INTO students (first_name, last_name, email, enrollment_date)
            VALUES (?, ?, ?, ?)
            RETURNING student_id
            """;

    private static final String UPDATE_EMAIL = "UPDATE students SET email = ? WHERE student_id = ?";

    private static final String DELETE = "DELETE FROM students WHERE student_id = ?";

    private final Database database;

    public JdbcStudentRepository(Database database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public List<StudentRecord> findAll() {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_ALL);
             ResultSet rs = ps.executeQuery()) {

            List<StudentRecord> out = new ArrayList<>();
            while (rs.next()) {
                out.add(map(rs, database.settings().isSqlite()));
            }
            return out;
        } catch (SQLException e) {
            log.error("Listing students failed", e);
            throw SqlErrors.translate(e, null);
        }
    }

    @Override
    public StudentId insert(NewStudent student) {
        try (Connection c = database.getConnection()) {
            try {
                long id = insertReturningId(c, student, database.settings().isSqlite());
                c.commit();
                return StudentId.of(id);
            } catch (SQLException e) {
                rollback(c);
                throw e;
            }
        } catch (SQLException e) {
            log.warn("Insert failed for email={}: {}", student.email(), e.getMessage());
            throw SqlErrors.translate(e, student.email());
        }
    }

    @Override
    public boolean updateEmail(StudentId id, String newEmail) {
        return mutateOne(UPDATE_EMAIL, newEmail, ps -> {
            ps.setString(1, newEmail);
            ps.setLong(2, id.value());
        });
    }

    @Override
    public boolean delete(StudentId id) {
        return mutateOne(DELETE, null, ps -> ps.setLong(1, id.value()));
    }

    private static long insertReturningId(Connection c, NewStudent student, boolean sqlite) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT)) {
            ps.setString(1, student.firstName());
            ps.setString(2, student.lastName());
            ps.setString(3, student.email());
            // SQLite has no DATE type: enrollment_date is ISO text there
            if (sqlite) ps.setString(4, student.enrollmentDate().toString());
            else ps.setObject(4, student.enrollmentDate());

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new SQLException("INSERT returned no student_id");
                return rs.getLong(1);
            }
        }
    }

    /**
     * Runs a single-row UPDATE/DELETE. Commits only when exactly the targeted row changed.
     */
    private boolean mutateOne(String sql, String email, Binder binder) {
        try (Connection c = database.getConnection()) {
            try {
                int rows;
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    binder.bind(ps);
                    rows = ps.executeUpdate();
                }

                if (rows == 0) {
                    c.rollback();
                    return false;
                }
                c.commit();
                return true;
            } catch (SQLException e) {
                rollback(c);
                throw e;
            }
        } catch (SQLException e) {
            log.warn("Statement failed [{}]: {}", sql, e.getMessage());
            throw SqlErrors.translate(e, email);
        }
    }

    private static StudentRecord map(ResultSet rs, boolean sqlite) throws SQLException {
        return new StudentRecord(
                StudentId.of(rs.getLong("student_id")),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("email"),
                sqlite
                        ? LocalDate.parse(rs.getString("enrollment_date"))
                        : rs.getObject("enrollment_date", LocalDate.class)
        );
    }

    private static void rollback(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
