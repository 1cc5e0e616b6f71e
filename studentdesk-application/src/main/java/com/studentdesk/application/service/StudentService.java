package com.studentdesk.application.service;

import com.studentdesk.application.error.StudentNotFoundException;
import com.studentdesk.application.ports.StudentRepository;
import com.studentdesk.application.validation.StudentInputValidator;
import com.studentdesk.domain.student.NewStudent;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * The four record operations. Entry point for the menu.
 *
 * Input arrives as raw text and is validated here before the repository is touched.
 * Failures are thrown, never printed: reporting them is the caller's job.
 */
public class StudentService {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository repository;

    public StudentService(StudentRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public List<StudentRecord> listAll() {
        List<StudentRecord> rows = repository.findAll();
        log.debug("Listed {} students", rows.size());
        return rows;
    }

    public StudentId create(String firstName, String lastName, String email, String enrollmentDate) {
        LocalDate date = StudentInputValidator.parseEnrollmentDate(enrollmentDate);
        NewStudent student = new NewStudent(
                StudentInputValidator.requireText("First name", firstName),
                StudentInputValidator.requireText("Last name", lastName),
                StudentInputValidator.requireText("Email", email),
                date
        );

        StudentId id = repository.insert(student);
        log.info("Student created id={}", id);
        return id;
    }

    public void updateEmail(String studentId, String newEmail) {
        StudentId id = StudentInputValidator.parseStudentId(studentId);
        String email = StudentInputValidator.requireText("New email", newEmail);

        if (!repository.updateEmail(id, email)) {
            log.info("Email update skipped, no student id={}", id);
            throw new StudentNotFoundException(id);
        }
        log.info("Student email updated id={}", id);
    }

    public void delete(String studentId) {
        StudentId id = StudentInputValidator.parseStudentId(studentId);

        if (!repository.delete(id)) {
            log.info("Delete skipped, no student id={}", id);
            throw new StudentNotFoundException(id);
        }
        log.info("Student deleted id={}", id);
    }
}
