package com.studentdesk.application.error;

import com.studentdesk.domain.DomainException;
import com.studentdesk.domain.student.StudentId;

import java.util.Objects;

/**
 * An update or delete matched zero rows. Nothing was committed.
 */
public final class StudentNotFoundException extends DomainException {

    private final StudentId studentId;

    public StudentNotFoundException(StudentId studentId) {
        super("No student found with that ID.");
        this.studentId = Objects.requireNonNull(studentId, "studentId");
    }

    public StudentId studentId() {
        return studentId;
    }
}
