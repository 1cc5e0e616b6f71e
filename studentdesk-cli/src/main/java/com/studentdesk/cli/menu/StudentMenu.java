package com.studentdesk.cli.menu;

import com.studentdesk.application.error.DuplicateEmailException;
import com.studentdesk.application.error.StoreConnectionException;
import com.studentdesk.application.error.StoreException;
import com.studentdesk.application.error.StudentNotFoundException;
import com.studentdesk.application.error.ValidationException;
import com.studentdesk.application.service.StudentService;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Interactive CRUD menu.
 *
 * Choices 1-4 run an operation and come back to the menu, 0 exits, anything else is rejected.
 * Fields are collected as raw text; validation belongs to {@link StudentService}.
 * Every failure is turned into one printed message here so the loop never dies on a bad operation.
 */
public final class StudentMenu {

    private static final Logger log = LoggerFactory.getLogger(StudentMenu.class);

    private final StudentService service;
    private final MenuIO io;

    public StudentMenu(StudentService service, MenuIO io) {
        this.service = Objects.requireNonNull(service, "service");
        this.io = Objects.requireNonNull(io, "io");
    }

    /** @return process exit code */
    public int run() {
        try {
            while (true) {
                printMainMenu();

                String choice = prompt("Choose an option");
                switch (choice) {
                    case "1" -> listStudents();
                    case "2" -> addStudent();
                    case "3" -> updateStudentEmail();
                    case "4" -> deleteStudent();
                    case "0" -> {
                        io.println("\nGoodbye.");
                        return 0;
                    }
                    default -> io.println("\nInvalid option. Please try again.\n");
                }
            }
        } catch (InputClosed e) {
            log.info("Input closed, leaving menu");
            io.println("\nGoodbye.");
            return 0;
        }
    }

    private void printMainMenu() {
        io.println("--- Students CRUD Menu ---");
        io.println("1. View all students");
        io.println("2. Add a student");
        io.println("3. Update student email");
        io.println("4. Delete a student");
        io.println("0. Exit");
    }

    private void listStudents() {
        List<StudentRecord> rows;
        try {
            rows = service.listAll();
        } catch (RuntimeException e) {
            report(e, "Failed to fetch students");
            return;
        }

        if (rows.isEmpty()) {
            io.println("\nNo students found.\n");
            return;
        }

        io.println("");
        StudentTable.render(rows).forEach(io::println);
        io.println("");
    }

    private void addStudent() {
        String first = prompt("First name");
        String last = prompt("Last name");
        String email = prompt("Email");
        String date = prompt("Enrollment date (YYYY-MM-DD)");

        try {
            StudentId id = service.create(first, last, email, date);
            io.println("\nStudent added with ID " + id + ".\n");
        } catch (RuntimeException e) {
            report(e, "Failed to add student");
        }
    }

    private void updateStudentEmail() {
        String sid = prompt("Student ID");
        String newEmail = prompt("New email");

        try {
            service.updateEmail(sid, newEmail);
            io.println("\nEmail updated successfully.\n");
        } catch (RuntimeException e) {
            report(e, "Failed to update email");
        }
    }

    private void deleteStudent() {
        String sid = prompt("Student ID to delete");

        try {
            service.delete(sid);
            io.println("\nStudent deleted successfully.\n");
        } catch (RuntimeException e) {
            report(e, "Failed to delete student");
        }
    }

    private void report(RuntimeException e, String storeFailurePrefix) {
        if (e instanceof StudentNotFoundException) {
            io.println("\n" + e.getMessage() + "\n");
        } else if (e instanceof ValidationException || e instanceof DuplicateEmailException) {
            error(e.getMessage());
        } else if (e instanceof StoreConnectionException sce) {
            error("Could not connect to database: " + sce.diagnostic());
        } else if (e instanceof StoreException se) {
            error(storeFailurePrefix + ": " + se.diagnostic());
        } else {
            log.error("Unexpected failure in menu operation", e);
            error(storeFailurePrefix + ": " + e);
        }
    }

    private void error(String message) {
        io.println("\n[ERROR] " + message + "\n");
    }

    private String prompt(String label) {
        String line = io.readLine(label);
        if (line == null) throw new InputClosed();
        return line.trim();
    }

    private static final class InputClosed extends RuntimeException {
        InputClosed() {
            super(null, null, false, false);
        }
    }
}
