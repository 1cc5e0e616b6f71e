package com.studentdesk.application.service;

import com.studentdesk.application.error.DuplicateEmailException;
import com.studentdesk.application.error.StudentNotFoundException;
import com.studentdesk.application.error.ValidationException;
import com.studentdesk.application.ports.StudentRepository;
import com.studentdesk.application.ports.impl.InMemoryStudentRepository;
import com.studentdesk.domain.student.NewStudent;
import com.studentdesk.domain.student.StudentId;
import com.studentdesk.domain.student.StudentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudentServiceTest {

    private InMemoryStudentRepository repository;
    private StudentService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryStudentRepository();
        service = new StudentService(repository);
    }

    @Test
    void createReturnsFreshIdAndListShowsRow() {
        StudentId first = service.create("Grace", "Hopper", "grace@x.com", "1928-09-01");
        StudentId second = service.create("Alan", "Turing", "alan@x.com", "1931-10-01");

        assertThat(second).isNotEqualTo(first);
        assertThat(service.listAll())
                .extracting(StudentRecord::id)
                .containsExactly(first, second);
        assertThat(service.listAll().get(1))
                .isEqualTo(new StudentRecord(second, "Alan", "Turing", "alan@x.com", LocalDate.of(1931, 10, 1)));
    }

    @Test
    void duplicateEmailIsRejectedAndNoRowAdded() {
        service.create("Grace", "Hopper", "same@x.com", "2023-09-01");

        assertThatThrownBy(() -> service.create("Other", "Person", "same@x.com", "2023-09-02"))
                .isInstanceOf(DuplicateEmailException.class);
        assertThat(service.listAll()).hasSize(1);
    }

    @Test
    void invalidDateNeverReachesRepository() {
        CountingRepository counting = new CountingRepository();
        StudentService s = new StudentService(counting);

        assertThatThrownBy(() -> s.create("Ada", "Lovelace", "ada@x.com", "2023-13-01"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> s.updateEmail("abc", "ada@x.com"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> s.delete("3.5"))
                .isInstanceOf(ValidationException.class);
        assertThat(counting.calls).isZero();
    }

    @Test
    void blankRequiredFieldIsValidationError() {
        assertThatThrownBy(() -> service.create("", "Lovelace", "ada@x.com", "2023-09-01"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("First name is required.");
        assertThat(service.listAll()).isEmpty();
    }

    @Test
    void updateEmailOfUnknownIdIsNotFoundAndChangesNothing() {
        StudentId id = service.create("Grace", "Hopper", "grace@x.com", "2023-09-01");
        List<StudentRecord> before = service.listAll();

        assertThatThrownBy(() -> service.updateEmail(String.valueOf(id.value() + 100), "new@x.com"))
                .isInstanceOf(StudentNotFoundException.class)
                .hasMessage("No student found with that ID.");
        assertThat(service.listAll()).isEqualTo(before);
    }

    @Test
    void updateEmailToTakenAddressIsDuplicate() {
        service.create("Grace", "Hopper", "grace@x.com", "2023-09-01");
        StudentId alan = service.create("Alan", "Turing", "alan@x.com", "2023-09-01");

        assertThatThrownBy(() -> service.updateEmail(alan.toString(), "grace@x.com"))
                .isInstanceOf(DuplicateEmailException.class);
    }

    @Test
    void deleteTwiceSucceedsThenNotFound() {
        StudentId id = service.create("Grace", "Hopper", "grace@x.com", "2023-09-01");

        service.delete(id.toString());

        assertThatThrownBy(() -> service.delete(id.toString()))
                .isInstanceOf(StudentNotFoundException.class)
                .satisfies(e -> assertThat(((StudentNotFoundException) e).studentId()).isEqualTo(id));
    }

    @Test
    void idsAreNotReusedAfterDelete() {
        StudentId first = service.create("Grace", "Hopper", "grace@x.com", "2023-09-01");
        service.delete(first.toString());

        StudentId next = service.create("Grace", "Hopper", "grace@x.com", "2023-09-01");

        assertThat(next.value()).isGreaterThan(first.value());
    }

    @Test
    void adaLovelaceLifecycle() {
        StudentId id = service.create("Ada", "Lovelace", "ada@x.com", "1843-12-10");
        assertThat(service.listAll())
                .containsExactly(new StudentRecord(id, "Ada", "Lovelace", "ada@x.com", LocalDate.of(1843, 12, 10)));

        service.updateEmail(id.toString(), "ada2@x.com");
        assertThat(service.listAll()).extracting(StudentRecord::email).containsExactly("ada2@x.com");

        service.delete(id.toString());
        assertThat(service.listAll()).extracting(StudentRecord::id).doesNotContain(id);
    }

    private static final class CountingRepository implements StudentRepository {
        int calls;

        @Override
        public List<StudentRecord> findAll() {
            calls++;
            return List.of();
        }

        @Override
        public StudentId insert(NewStudent student) {
            calls++;
            return StudentId.of(1);
        }

        @Override
        public boolean updateEmail(StudentId id, String newEmail) {
            calls++;
            return true;
        }

        @Override
        public boolean delete(StudentId id) {
            calls++;
            return true;
        }
    }
}
