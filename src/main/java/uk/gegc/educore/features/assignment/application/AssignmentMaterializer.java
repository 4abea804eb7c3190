package uk.gegc.educore.features.assignment.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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

/**
 * Creates the assignments implied by subject enrollments: every active enrollment with
 * auto-assignment on gets one assignment per non-deleted lesson and exam of its subject.
 * <p>
 * Rows are inserted with insert-or-ignore on the (enrollment, content) key, so running
 * either entry point again for the same pair inserts nothing. Existing assignments are
 * never removed. Both entry points join the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentMaterializer {

    private final AssignmentRepository assignmentRepository;
    private final LessonRepository lessonRepository;
    private final ExamRepository examRepository;
    private final SubjectEnrollmentRepository enrollmentRepository;
    private final AutoAssignmentProperties autoAssignmentProperties;
    private final CoreMetricsService metricsService;

    /**
     * Called when an enrollment is created or moves back to active.
     */
    @Transactional
    public MaterializationResult onEnrollmentActivated(Subject subject, SubjectEnrollment enrollment) {
        if (enrollment.getStatus() != EnrollmentStatus.ACTIVE) {
            return MaterializationResult.EMPTY;
        }

        List<Lesson> lessons = lessonRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId());
        List<Exam> exams = examRepository.findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(subject.getId());

        int lessonCreated = 0;
        for (Lesson lesson : lessons) {
            lessonCreated += insertLesson(subject, enrollment, lesson.getId());
        }
        int examCreated = 0;
        for (Exam exam : exams) {
            examCreated += insertExam(subject, enrollment, exam.getId());
        }

        MaterializationResult result = new MaterializationResult(lessons.size(), lessonCreated, exams.size(), examCreated);
        record(result);
        log.info("Materialized assignments for enrollment {} in subject {}: {}", enrollment.getId(), subject.getId(), result);
        return result;
    }

    /**
     * Called when a lesson or exam is published under a subject.
     */
    @Transactional
    public MaterializationResult onContentPublished(Subject subject, ContentRef content) {
        List<SubjectEnrollment> enrollments = enrollmentRepository
                .findAllBySubjectIdAndStatusAndAutoAssignFutureTrue(subject.getId(), EnrollmentStatus.ACTIVE);

        int created = 0;
        for (SubjectEnrollment enrollment : enrollments) {
            created += content.kind() == ContentRef.Kind.LESSON
                    ? insertLesson(subject, enrollment, content.id())
                    : insertExam(subject, enrollment, content.id());
        }

        MaterializationResult result = content.kind() == ContentRef.Kind.LESSON
                ? new MaterializationResult(enrollments.size(), created, 0, 0)
                : new MaterializationResult(0, 0, enrollments.size(), created);
        record(result);
        log.info("Materialized assignments for new {} {} in subject {}: {}",
                content.kind(), content.id(), subject.getId(), result);
        return result;
    }

    private int insertLesson(Subject subject, SubjectEnrollment enrollment, UUID lessonId) {
        return assignmentRepository.insertAutoLessonAssignmentIfAbsent(
                UUID.randomUUID().toString(),
                subject.getTenantId().toString(),
                enrollment.getStudentId().toString(),
                subject.getTeacherOwnerId().toString(),
                lessonId.toString(),
                enrollment.getId().toString(),
                autoAssignmentProperties.getAssignmentType().name(),
                autoAssignmentProperties.getMaxAttempts(),
                Assignment.autoKeyForLesson(enrollment.getId(), lessonId)
        );
    }

    private int insertExam(Subject subject, SubjectEnrollment enrollment, UUID examId) {
        return assignmentRepository.insertAutoExamAssignmentIfAbsent(
                UUID.randomUUID().toString(),
                subject.getTenantId().toString(),
                enrollment.getStudentId().toString(),
                subject.getTeacherOwnerId().toString(),
                examId.toString(),
                enrollment.getId().toString(),
                autoAssignmentProperties.getAssignmentType().name(),
                autoAssignmentProperties.getMaxAttempts(),
                Assignment.autoKeyForExam(enrollment.getId(), examId)
        );
    }

    private void record(MaterializationResult result) {
        metricsService.recordAutoAssign(result.created(), result.skipped());
    }
}
