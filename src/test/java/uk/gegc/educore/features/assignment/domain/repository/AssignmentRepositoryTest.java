package uk.gegc.educore.features.assignment.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.model.AssignmentSource;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class AssignmentRepositoryTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID TEACHER = UUID.randomUUID();

    @Autowired
    private AssignmentRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private int insertExam(UUID studentId, UUID enrollmentId, UUID examId) {
        return repository.insertAutoExamAssignmentIfAbsent(
                UUID.randomUUID().toString(), TENANT.toString(), studentId.toString(), TEACHER.toString(),
                examId.toString(), enrollmentId.toString(), AssignmentType.PRACTICE.name(), 3,
                Assignment.autoKeyForExam(enrollmentId, examId));
    }

    @Test
    @DisplayName("auto-assignment insert is a no-op for an existing (enrollment, exam) pair")
    void insertIfAbsent_isIdempotent() {
        UUID studentId = UUID.randomUUID();
        UUID enrollmentId = UUID.randomUUID();
        UUID examId = UUID.randomUUID();

        assertThat(insertExam(studentId, enrollmentId, examId)).isEqualTo(1);
        assertThat(insertExam(studentId, enrollmentId, examId)).isZero();
        entityManager.clear();

        List<Assignment> rows = repository.findAllByTenantIdAndAssigneeStudentIdOrderByCreatedAtDesc(TENANT, studentId);
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getExamId()).isEqualTo(examId);
            assertThat(row.getLessonId()).isNull();
            assertThat(row.getAssignmentSource()).isEqualTo(AssignmentSource.SUBJECT_AUTO);
            assertThat(row.getSubjectEnrollmentId()).isEqualTo(enrollmentId);
            assertThat(row.getMaxAttempts()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("the same content for a different enrollment is a separate assignment")
    void insertIfAbsent_keyedPerEnrollment() {
        UUID lessonId = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        int created = 0;
        for (UUID enrollmentId : List.of(first, second, first)) {
            created += repository.insertAutoLessonAssignmentIfAbsent(
                    UUID.randomUUID().toString(), TENANT.toString(), UUID.randomUUID().toString(), TEACHER.toString(),
                    lessonId.toString(), enrollmentId.toString(), AssignmentType.PRACTICE.name(), 3,
                    Assignment.autoKeyForLesson(enrollmentId, lessonId));
        }

        assertThat(created).isEqualTo(2);
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("manual rows without a key never collide")
    void manualRowsAllowed() {
        UUID studentId = UUID.randomUUID();
        UUID examId = UUID.randomUUID();
        for (int i = 0; i < 2; i++) {
            Assignment manual = new Assignment();
            manual.setTenantId(TENANT);
            manual.setAssigneeStudentId(studentId);
            manual.setAssignedByTeacherId(TEACHER);
            manual.setExamId(examId);
            manual.setAssignmentSource(AssignmentSource.MANUAL);
            manual.setAssignmentType(AssignmentType.ASSESSMENT);
            manual.setMaxAttempts(1);
            entityManager.persist(manual);
        }
        entityManager.flush();

        assertThat(repository.existsByTenantIdAndAssigneeStudentIdAndExamId(TENANT, studentId, examId)).isTrue();
        assertThat(repository.findAllByTenantIdAndAssigneeStudentIdOrderByCreatedAtDesc(TENANT, studentId)).hasSize(2);
    }
}
