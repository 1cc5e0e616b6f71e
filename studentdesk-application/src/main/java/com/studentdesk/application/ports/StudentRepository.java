package com.studentdesk.application.ports;

import com.studentdesk.domain.student.NewStudent;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;

import java.util.List;

/**
 * Persistence port for the {@code students} table.
 *
 * Every call runs in its own unit of work: a mutation is committed only when it
 * matched a row, otherwise it is rolled back.
 *
 * Failures are reported with the exceptions in {@code com.studentdesk.application.error}:
 * {@code DuplicateEmailException} for a uniqueness violation, {@code StoreConnectionException}
 * when the store cannot be reached and {@code StoreException} for anything else.
 */
public interface StudentRepository {

    /** All rows ordered by id ascending. */
    List<StudentRecord> findAll();

    /** Inserts the row and returns the id generated by the store. */
    StudentId insert(NewStudent student);

    /** @return false when no row has the given id */
    boolean updateEmail(StudentId id, String newEmail);

    /** @return false when no row has the given id */
    boolean delete(StudentId id);
}
