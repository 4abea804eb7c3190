package uk.gegc.educore.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.assignment.api.dto.AssignmentDto;
import uk.gegc.educore.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.educore.features.assignment.api.dto.MyAssignmentDto;
import uk.gegc.educore.features.assignment.application.AssignmentService;
import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.model.AssignmentSource;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;
import uk.gegc.educore.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.educore.features.attempt.domain.repository.AttemptCountProjection;
import uk.gegc.educore.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.exam.domain.repository.ExamRepository;
import uk.gegc.educore.features.lesson.domain.model.Lesson;
import uk.gegc.educore.features.lesson.domain.repository.LessonRepository;
import uk.gegc.educore.features.subject.application.ManualEnrollmentResult;
import uk.gegc.educore.features.subject.application.SubjectService;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;
import uk.gegc.educore.features.subject.domain.repository.SubjectEnrollmentRepository;
import uk.gegc.educore.features.subject.domain.repository.SubjectRepository;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;
import uk.gegc.educore.shared.exception.ValidationException;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;
import uk.gegc.educore.shared.security.TenantMembershipResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentServiceImpl implements AssignmentService {

    private final AssignmentRepository assignmentRepository;
    private final AttemptRepository attemptRepository;
    private final LessonRepository lessonRepository;
    private final ExamRepository examRepository;
    private final SubjectRepository subjectRepository;
    private final SubjectEnrollmentRepository enrollmentRepository;
    private final SubjectService subjectService;
    private final TenantMembershipResolver membershipResolver;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;

    private record Target(Subject subject, UUID lessonId, UUID examId) {
    }

    @Override
    @Transactional
    public List<AssignmentDto> createAssignments(CallerContext caller, CreateAssignmentRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Target target = resolveTarget(caller, request);

        Set<UUID> studentIds = new LinkedHashSet<>();
        if (request.studentIds() != null) {
            request.studentIds().stream().filter(Objects::nonNull).forEach(studentIds::add);
        }
        if (studentIds.isEmpty()) {
            throw new ValidationException("At least one student ID is required");
        }
        boolean allStudents = studentIds.stream()
                .allMatch(studentId -> membershipResolver.isActiveStudent(caller.tenantId(), studentId));
        if (!allStudents) {
            throw new ValidationException("One or more student IDs are invalid/inactive or not in this tenant");
        }

        AssignmentType assignmentType = request.assignmentType() != null ? request.assignmentType() : AssignmentType.PRACTICE;
        int maxAttempts = request.maxAttempts() != null ? request.maxAttempts() : assignmentType.defaultMaxAttempts();

        Subject subject = target.subject();
        List<Assignment> assignments = new ArrayList<>();
        for (UUID studentId : studentIds) {
            ManualEnrollmentResult enrollment = subjectService.ensureEnrollmentForManualAssignment(caller, subject, studentId);

            Assignment assignment = new Assignment();
            assignment.setTenantId(caller.tenantId());
            assignment.setAssigneeStudentId(studentId);
            assignment.setAssignedByTeacherId(subject.getTeacherOwnerId());
            assignment.setLessonId(target.lessonId());
            assignment.setExamId(target.examId());
            assignment.setAssignmentSource(AssignmentSource.MANUAL);
            assignment.setSubjectEnrollmentId(enrollment.enrollmentId());
            assignment.setAssignmentType(assignmentType);
            assignment.setMaxAttempts(maxAttempts);
            assignment.setDueAt(request.dueAt());
            assignments.add(assignment);
        }
        List<Assignment> saved = assignmentRepository.saveAll(assignments);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("studentCount", saved.size());
        metadata.put("lessonId", target.lessonId());
        metadata.put("examId", target.examId());
        metadata.put("subjectId", subject.getId());
        metadata.put("teacherOwnerId", subject.getTeacherOwnerId());
        metadata.put("assignmentType", assignmentType.name());
        metadata.put("maxAttempts", maxAttempts);
        auditService.record(caller, "assignment.create", "assignment_batch", null, metadata);

        log.info("Created {} manual assignments of {} in subject {}", saved.size(),
                target.examId() != null ? "exam " + target.examId() : "lesson " + target.lessonId(), subject.getId());
        return saved.stream().map(AssignmentDto::from).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MyAssignmentDto> getMyAssignments(CallerContext caller) {
        accessPolicy.requireStudent(caller);
        List<Assignment> assignments = assignmentRepository
                .findAllByTenantIdAndAssigneeStudentIdOrderByCreatedAtDesc(caller.tenantId(), caller.userId());
        if (assignments.isEmpty()) {
            return List.of();
        }

        Map<UUID, Long> attemptCounts = attemptRepository
                .countByAssignmentIds(assignments.stream().map(Assignment::getId).toList())
                .stream()
                .collect(Collectors.toMap(AttemptCountProjection::getAssignmentId, AttemptCountProjection::getAttemptCount));
        Map<UUID, Lesson> lessons = byId(lessonRepository.findAllById(idsOf(assignments, Assignment::getLessonId)), Lesson::getId);
        Map<UUID, Exam> exams = byId(examRepository.findAllById(idsOf(assignments, Assignment::getExamId)), Exam::getId);
        Map<UUID, SubjectEnrollment> enrollments = byId(
                enrollmentRepository.findAllById(idsOf(assignments, Assignment::getSubjectEnrollmentId)), SubjectEnrollment::getId);

        Set<UUID> subjectIds = new LinkedHashSet<>();
        lessons.values().forEach(lesson -> subjectIds.add(lesson.getSubjectId()));
        exams.values().forEach(exam -> subjectIds.add(exam.getSubjectId()));
        Map<UUID, Subject> subjects = byId(subjectRepository.findAllById(subjectIds), Subject::getId);

        return assignments.stream().map(assignment -> {
            Lesson lesson = assignment.getLessonId() != null ? lessons.get(assignment.getLessonId()) : null;
            Exam exam = assignment.getExamId() != null ? exams.get(assignment.getExamId()) : null;
            UUID subjectId = lesson != null ? lesson.getSubjectId() : exam != null ? exam.getSubjectId() : null;
            Subject subject = subjectId != null ? subjects.get(subjectId) : null;
            SubjectEnrollment enrollment = assignment.getSubjectEnrollmentId() != null
                    ? enrollments.get(assignment.getSubjectEnrollmentId())
                    : null;

            return new MyAssignmentDto(
                    assignment.getId(),
                    assignment.getAssignedByTeacherId(),
                    assignment.getLessonId(),
                    assignment.getExamId(),
                    lesson != null ? lesson.getTitle() : exam != null ? exam.getTitle() : null,
                    subjectId,
                    subject != null ? subject.getName() : null,
                    assignment.getAssignmentType(),
                    assignment.getAssignmentSource(),
                    assignment.getMaxAttempts(),
                    attemptCounts.getOrDefault(assignment.getId(), 0L),
                    enrollment != null ? enrollment.getStatus() : null,
                    assignment.getDueAt(),
                    assignment.getCreatedAt()
            );
        }).toList();
    }

    private Target resolveTarget(CallerContext caller, CreateAssignmentRequest request) {
        if (request.lessonId() != null && request.examId() != null) {
            throw new ValidationException("Assignment must reference exactly one of lessonId or examId");
        }
        if (request.lessonId() == null && request.examId() == null) {
            throw new ValidationException("Assignment must reference lessonId or examId");
        }

        if (request.lessonId() != null) {
            Lesson lesson = lessonRepository.findByIdAndTenantIdAndDeletedFalse(request.lessonId(), caller.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Lesson not found"));
            Subject subject = subjectService.assertSubjectAccess(caller, lesson.getSubjectId());
            return new Target(subject, lesson.getId(), null);
        }

        Exam exam = examRepository.findByIdAndTenantIdAndDeletedFalse(request.examId(), caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Exam not found"));
        Subject subject = subjectService.assertSubjectAccess(caller, exam.getSubjectId());
        return new Target(subject, null, exam.getId());
    }

    private static Set<UUID> idsOf(List<Assignment> assignments, Function<Assignment, UUID> getter) {
        return assignments.stream().map(getter).filter(Objects::nonNull).collect(Collectors.toSet());
    }

    private static <T> Map<UUID, T> byId(List<T> entities, Function<T, UUID> idGetter) {
        return entities.stream().collect(Collectors.toMap(idGetter, Function.identity()));
    }
}
