package uk.gegc.educore.features.assignment.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.educore.features.assignment.config.AutoAssignmentProperties;
import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.exam.domain.repository.ExamRepository;
import uk.gegc.educore.features.lesson.domain.model.Lesson;
import uk.gegc.educore.features.lesson.domain.repository.LessonRepository;
import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;
import uk.gegc.educore.features.subject.domain.repository.SubjectEnrollmentRepository;
import uk.gegc.educore.shared.metrics.CoreMetricsService;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssignmentMaterializer")
class AssignmentMaterializerTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID OWNER = UUID.randomUUID();

    @Mock
    private AssignmentRepository assignmentRepository;
    @Mock
    private LessonRepository lessonRepository;
    @Mock
    private ExamRepository examRepository;
    @Mock
    private SubjectEnrollmentRepository enrollmentRepository;
    @Mock
    private CoreMetricsService metricsService;

    private AssignmentMaterializer materializer;
    private Subject subject;

    @BeforeEach
    void setUp() {
        materializer = new AssignmentMaterializer(assignmentRepository, lessonRepository, examRepository,
                enrollmentRepository, new AutoAssignmentProperties(), metricsService);
        subject = new Subject();
        subject.setId(UUID.randomUUID());
        subject.setTenantId(TENANT);
        subject.setTeacherOwnerId(OWNER);
        subject.setName("Biology");
        subject.setNameNormalized("Biology");
    }

    private SubjectEnrollment enrollment(EnrollmentStatus status) {
        SubjectEnrollment enrollment = new SubjectEnrollment();
        enrollment.setId(UUID.randomUUID());
        enrollment.setTenantId(TENANT);
        enrollment.setSubjectId(subject.getId());
        enrollment.setStudentId(UUID.randomUUID());
        enrollment.setEnrolledByUserId(OWNER);
        enrollment.setStatus(status);
        return enrollment;
    }

    private Lesson lesson() {
        Lesson lesson = new Lesson();
        lesson.setId(UUID.randomUUID());
        lesson.setSubjectId(subject.getId());
        return lesson;
    }

    private Exam exam() {
        Exam exam = new Exam();
        exam.setId(UUID.randomUUID());
        exam.setSubjectId(subject.getId());
        return exam;
    }

    @Nested
    @DisplayName("onEnrollmentActivated")
    class EnrollmentActivated {

        @Test
        @DisplayName("assigns every lesson and exam of the subject")
        void assignsExistingContent() {
            SubjectEnrollment enrollment = enrollment(EnrollmentStatus.ACTIVE);
            Lesson first = lesson();
            Lesson second = lesson();
            Exam exam = exam();
            when(lessonRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId()))
                    .thenReturn(List.of(first, second));
            when(examRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId()))
                    .thenReturn(List.of(exam));
            when(assignmentRepository.insertAutoLessonAssignmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyInt(), anyString())).thenReturn(1);
            when(assignmentRepository.insertAutoExamAssignmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyInt(), anyString())).thenReturn(1);

            MaterializationResult result = materializer.onEnrollmentActivated(subject, enrollment);

            assertThat(result).isEqualTo(new MaterializationResult(2, 2, 1, 1));
            assertThat(result.created()).isEqualTo(3);
            assertThat(result.skipped()).isZero();
            verify(assignmentRepository).insertAutoExamAssignmentIfAbsent(anyString(),
                    eq(TENANT.toString()), eq(enrollment.getStudentId().toString()), eq(OWNER.toString()),
                    eq(exam.getId().toString()), eq(enrollment.getId().toString()), eq("PRACTICE"), eq(3),
                    eq(Assignment.autoKeyForExam(enrollment.getId(), exam.getId())));
            verify(metricsService).recordAutoAssign(3, 0);
        }

        @Test
        @DisplayName("a rerun inserts nothing and reports every pair as skipped")
        void rerunIsIdempotent() {
            SubjectEnrollment enrollment = enrollment(EnrollmentStatus.ACTIVE);
            when(lessonRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId()))
                    .thenReturn(List.of(lesson(), lesson()));
            when(examRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId()))
                    .thenReturn(List.of(exam()));
            when(assignmentRepository.insertAutoLessonAssignmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyInt(), anyString())).thenReturn(0);
            when(assignmentRepository.insertAutoExamAssignmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyInt(), anyString())).thenReturn(0);

            MaterializationResult result = materializer.onEnrollmentActivated(subject, enrollment);

            assertThat(result.created()).isZero();
            assertThat(result.skipped()).isEqualTo(3);
            verify(metricsService).recordAutoAssign(0, 3);
        }

        @Test
        @DisplayName("completed enrollments get nothing")
        void completedEnrollmentIgnored() {
            MaterializationResult result = materializer.onEnrollmentActivated(subject,
                    enrollment(EnrollmentStatus.COMPLETED));

            assertThat(result).isSameAs(MaterializationResult.EMPTY);
            verifyNoInteractions(lessonRepository, examRepository, assignmentRepository, metricsService);
        }
    }

    @Nested
    @DisplayName("onContentPublished")
    class ContentPublished {

        @Test
        @DisplayName("assigns a new lesson to every active auto-assign enrollment")
        void lessonFansOut() {
            UUID lessonId = UUID.randomUUID();
            when(enrollmentRepository.findAllBySubjectIdAndStatusAndAutoAssignFutureTrue(subject.getId(),
                    EnrollmentStatus.ACTIVE))
                    .thenReturn(List.of(enrollment(EnrollmentStatus.ACTIVE), enrollment(EnrollmentStatus.ACTIVE)));
            when(assignmentRepository.insertAutoLessonAssignmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), eq(lessonId.toString()), anyString(), anyString(), anyInt(), anyString()))
                    .thenReturn(1, 0);

            MaterializationResult result = materializer.onContentPublished(subject, ContentRef.lesson(lessonId));

            assertThat(result).isEqualTo(new MaterializationResult(2, 1, 0, 0));
            verify(assignmentRepository, times(2)).insertAutoLessonAssignmentIfAbsent(anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyString(), anyInt(), anyString());
            verify(assignmentRepository, never()).insertAutoExamAssignmentIfAbsent(anyString(), anyString(),
                    anyString(), anyString(), anyString(), anyString(), anyString(), anyInt(), anyString());
            verify(metricsService).recordAutoAssign(1, 1);
        }

        @Test
        @DisplayName("no enrollments means no inserts")
        void noEnrollments() {
            when(enrollmentRepository.findAllBySubjectIdAndStatusAndAutoAssignFutureTrue(subject.getId(),
                    EnrollmentStatus.ACTIVE)).thenReturn(List.of());

            MaterializationResult result = materializer.onContentPublished(subject, ContentRef.exam(UUID.randomUUID()));

            assertThat(result.created()).isZero();
            assertThat(result.skipped()).isZero();
            verifyNoInteractions(assignmentRepository);
        }
    }
}
