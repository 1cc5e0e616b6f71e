package com.studentdesk.domain.student;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Validated input for inserting a student. The id is assigned by the store.
 */
public record NewStudent(String firstName, String lastName, String email, LocalDate enrollmentDate) {

    public NewStudent {
        Objects.requireNonNull(firstName, "firstName");
        Objects.requireNonNull(lastName, "lastName");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(enrollmentDate, "enrollmentDate");
        if (firstName.isBlank()) throw new IllegalArgumentException("firstName is blank");
        if (lastName.isBlank()) throw new IllegalArgumentException("lastName is blank");
        if (email.isBlank()) throw new IllegalArgumentException("email is blank");
    }

    public StudentRecord withId(StudentId id) {
        return new StudentRecord(id, firstName, lastName, email, enrollmentDate);
    }
}
