package uk.gegc.educore.features.assignment.domain.repository;

import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
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
import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptResponse;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;
import uk.gegc.educore.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.lesson.domain.model.Lesson;
import uk.gegc.educore.features.subject.domain.model.Subject;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the Flyway schema so the keys and constraints the services rely on are the
 * ones production gets.
 */
@DataJpaTest
@ActiveProfiles({"test", "migrated"})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("V1 schema constraints")
class MigratedSchemaConstraintsTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID TEACHER = UUID.randomUUID();
    private static final UUID STUDENT = UUID.randomUUID();

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private AttemptRepository attemptRepository;

    private Subject subject;
    private Lesson lesson;
    private Exam exam;

    @BeforeEach
    void setUp() {
        subject = new Subject();
        subject.setTenantId(TENANT);
        subject.setTeacherOwnerId(TEACHER);
        subject.setName("Physics");
        subject.setNameNormalized("physics");
        entityManager.persist(subject);

        lesson = new Lesson();
        lesson.setTenantId(TENANT);
        lesson.setSubjectId(subject.getId());
        lesson.setTitle("Forces");
        lesson.setUploadedById(TEACHER);
        entityManager.persist(lesson);

        exam = new Exam();
        exam.setTenantId(TENANT);
        exam.setSubjectId(subject.getId());
        exam.setTitle("Forces quiz");
        exam.setSubjectName("Physics");
        exam.setNormalizedJson("{\"title\":\"Forces quiz\",\"questions\":[]}");
        exam.setNormalizedSchemaVersion(Exam.SCHEMA_VERSION);
        exam.setUploadedById(TEACHER);
        entityManager.persist(exam);
        entityManager.flush();
    }

    private Assignment manualAssignment(UUID lessonId, UUID examId) {
        Assignment assignment = new Assignment();
        assignment.setTenantId(TENANT);
        assignment.setAssigneeStudentId(STUDENT);
        assignment.setAssignedByTeacherId(TEACHER);
        assignment.setLessonId(lessonId);
        assignment.setExamId(examId);
        assignment.setAssignmentSource(AssignmentSource.MANUAL);
        assignment.setAssignmentType(AssignmentType.ASSESSMENT);
        assignment.setMaxAttempts(1);
        return assignment;
    }

    @Test
    @DisplayName("an assignment must target exactly one of lesson or exam")
    void oneTargetCheck() {
        entityManager.persist(manualAssignment(lesson.getId(), exam.getId()));

        assertThatThrownBy(() -> entityManager.flush()).isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("an assignment without any target is rejected")
    void noTargetCheck() {
        entityManager.persist(manualAssignment(null, null));

        assertThatThrownBy(() -> entityManager.flush()).isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("assignments cannot point at content that does not exist")
    void contentForeignKey() {
        entityManager.persist(manualAssignment(UUID.randomUUID(), null));

        assertThatThrownBy(() -> entityManager.flush()).isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("two subjects with the same normalized name for one owner collide")
    void subjectNameUnique() {
        Subject duplicate = new Subject();
        duplicate.setTenantId(TENANT);
        duplicate.setTeacherOwnerId(TEACHER);
        duplicate.setName("PHYSICS");
        duplicate.setNameNormalized("physics");
        entityManager.persist(duplicate);

        assertThatThrownBy(() -> entityManager.flush()).isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("attempt rows round-trip and only one submit wins")
    void attemptRoundTrip() {
        Assignment assignment = entityManager.persist(manualAssignment(null, exam.getId()));

        Attempt attempt = new Attempt();
        attempt.setTenantId(TENANT);
        attempt.setAssignmentId(assignment.getId());
        attempt.setExamId(exam.getId());
        attempt.setStudentId(STUDENT);
        attempt.setStatus(AttemptStatus.IN_PROGRESS);
        entityManager.persist(attempt);

        AttemptResponse response = new AttemptResponse();
        response.setAttemptId(attempt.getId());
        response.setQuestionId("q1");
        response.setAnswerJson("\"B\"");
        entityManager.persist(response);
        entityManager.flush();

        Instant submittedAt = Instant.now();
        assertThat(attemptRepository.markSubmitted(attempt.getId(), TENANT, STUDENT, submittedAt)).isEqualTo(1);
        assertThat(attemptRepository.markSubmitted(attempt.getId(), TENANT, STUDENT, submittedAt)).isZero();

        Attempt reloaded = attemptRepository.findByIdAndTenantId(attempt.getId(), TENANT).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(AttemptStatus.SUBMITTED);
        assertThat(reloaded.getSubmittedAt()).isNotNull();
        assertThat(assignmentRepository.existsByTenantIdAndAssigneeStudentIdAndExamId(TENANT, STUDENT, exam.getId())).isTrue();
    }

    @Test
    @DisplayName("one response row per (attempt, question)")
    void responseUniquePerQuestion() {
        Assignment assignment = entityManager.persist(manualAssignment(null, exam.getId()));
        Attempt attempt = new Attempt();
        attempt.setTenantId(TENANT);
        attempt.setAssignmentId(assignment.getId());
        attempt.setExamId(exam.getId());
        attempt.setStudentId(STUDENT);
        attempt.setStatus(AttemptStatus.IN_PROGRESS);
        entityManager.persist(attempt);

        for (int i = 0; i < 2; i++) {
            AttemptResponse response = new AttemptResponse();
            response.setAttemptId(attempt.getId());
            response.setQuestionId("q1");
            entityManager.persist(response);
        }

        assertThatThrownBy(() -> entityManager.flush()).isInstanceOf(PersistenceException.class);
    }
}
