package com.studentdesk.cli.menu;

import com.studentdesk.domain.student.StudentRecord;

import java.util.ArrayList;
import java.util.List;

final class StudentTable {

    private StudentTable() {}

    static final String HEADER = "ID | First Name | Last Name | Email | Enrollment Date";
    static final String RULE = "-".repeat(70);

    static List<String> render(List<StudentRecord> rows) {
        List<String> lines = new ArrayList<>(rows.size() + 3);
        lines.add("All Students:");
        lines.add(HEADER);
        lines.add(RULE);
        for (StudentRecord r : rows) {
            lines.add(r.id() + " | " + r.firstName() + " | " + r.lastName() + " | " + r.email() + " | " + r.enrollmentDate());
        }
        return lines;
    }
}
