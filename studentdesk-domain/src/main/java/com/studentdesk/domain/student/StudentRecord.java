package com.studentdesk.domain.student;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of the {@code students} table.
 * Only {@code email} can change after creation.
 */
public record StudentRecord(
        StudentId id,
        String firstName,
        String lastName,
        String email,
        LocalDate enrollmentDate
) {
    public StudentRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(firstName, "firstName");
        Objects.requireNonNull(lastName, "lastName");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(enrollmentDate, "enrollmentDate");
    }

    public StudentRecord withEmail(String newEmail) {
        return new StudentRecord(id, firstName, lastName, newEmail, enrollmentDate);
    }
}
