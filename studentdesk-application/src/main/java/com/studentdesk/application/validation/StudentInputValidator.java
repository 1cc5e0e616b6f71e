package com.studentdesk.application.validation;

import com.studentdesk.application.error.ValidationException;
import com.studentdesk.domain.student.StudentId;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Shape checks for raw menu input. Nothing here talks to the store.
 */
public final class StudentInputValidator {

    private StudentInputValidator() {}

    public static final String DATE_FORMAT_MESSAGE = "Invalid date format. Use YYYY-MM-DD (e.g., 2023-09-01).";
    public static final String STUDENT_ID_MESSAGE = "Invalid student ID. Please enter a number.";

    private static final Pattern ISO_DATE_SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    // STRICT rejects 2023-02-30 instead of clamping it to the 28th
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Parses a {@code YYYY-MM-DD} date that exists in the calendar.
     */
    public static LocalDate parseEnrollmentDate(String raw) {
        if (raw == null) throw new ValidationException(DATE_FORMAT_MESSAGE);
        String s = raw.trim();
        if (!ISO_DATE_SHAPE.matcher(s).matches()) {
            throw new ValidationException(DATE_FORMAT_MESSAGE);
        }
        LocalDate date;
        try {
            date = LocalDate.parse(s, ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new ValidationException(DATE_FORMAT_MESSAGE, e);
        }
        // uuuu accepts year 0, which has no AD/CE date to store
        if (date.getYear() < 1) throw new ValidationException(DATE_FORMAT_MESSAGE);
        return date;
    }

    /**
     * Parses a whole number. Whether a row with that id exists is the store's business.
     */
    public static StudentId parseStudentId(String raw) {
        if (raw == null || raw.isBlank()) throw new ValidationException(STUDENT_ID_MESSAGE);
        try {
            return StudentId.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException(STUDENT_ID_MESSAGE, e);
        }
    }

    public static String requireText(String label, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(label + " is required.");
        }
        return raw.trim();
    }
}
