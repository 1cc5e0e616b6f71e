package com.studentdesk.application.ports.impl;

import com.studentdesk.application.error.DuplicateEmailException;
import com.studentdesk.application.ports.StudentRepository;
import com.studentdesk.domain.student.NewStudent;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dev-only repository with the same contract as the JDBC one
 * (ids never reused, unique email). Use the JDBC implementation in infrastructure for real data.
 */
public final class InMemoryStudentRepository implements StudentRepository {

    private final TreeMap<Long, StudentRecord> byId = new TreeMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized List<StudentRecord> findAll() {
        return new ArrayList<>(byId.values());
    }

    @Override
    public synchronized StudentId insert(NewStudent student) {
        ensureEmailFree(student.email(), null);
        StudentId id = StudentId.of(sequence.incrementAndGet());
        byId.put(id.value(), student.withId(id));
        return id;
    }

    @Override
    public synchronized boolean updateEmail(StudentId id, String newEmail) {
        StudentRecord current = byId.get(id.value());
        if (current == null) return false;
        ensureEmailFree(newEmail, id);
        byId.put(id.value(), current.withEmail(newEmail));
        return true;
    }

    @Override
    public synchronized boolean delete(StudentId id) {
        return byId.remove(id.value()) != null;
    }

    private void ensureEmailFree(String email, StudentId except) {
        for (StudentRecord r : byId.values()) {
            if (r.email().equals(email) && !r.id().equals(except)) {
                throw new DuplicateEmailException(email);
            }
        }
    }
}
