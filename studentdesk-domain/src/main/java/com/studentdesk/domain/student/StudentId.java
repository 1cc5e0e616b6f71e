package com.studentdesk.domain.student;

/**
 * Store-generated identifier of a student row.
 */
public record StudentId(long value) {

    public static StudentId of(long value) {
        return new StudentId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
