package uk.gegc.educore.features.subject.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.assignment.application.AssignmentMaterializer;
import uk.gegc.educore.features.assignment.application.MaterializationResult;
import uk.gegc.educore.features.subject.api.dto.CreateSubjectRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollStudentRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollmentChangeResponse;
import uk.gegc.educore.features.subject.api.dto.SubjectDto;
import uk.gegc.educore.features.subject.api.dto.SubjectEnrollmentDto;
import uk.gegc.educore.features.subject.api.dto.UpdateEnrollmentRequest;
import uk.gegc.educore.features.subject.api.dto.UpdateSubjectRequest;
import uk.gegc.educore.features.subject.application.ManualEnrollmentResult;
import uk.gegc.educore.features.subject.application.SubjectService;
import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;
import uk.gegc.educore.features.subject.domain.repository.SubjectEnrollmentRepository;
import uk.gegc.educore.features.subject.domain.repository.SubjectRepository;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ConflictException;
import uk.gegc.educore.shared.exception.ForbiddenException;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;
import uk.gegc.educore.shared.exception.ValidationException;
import uk.gegc.educore.shared.metrics.CoreMetricsService;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;
import uk.gegc.educore.shared.security.TenantMembershipResolver;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectServiceImpl implements SubjectService {

    private final SubjectRepository subjectRepository;
    private final SubjectEnrollmentRepository enrollmentRepository;
    private final AssignmentMaterializer assignmentMaterializer;
    private final TenantMembershipResolver membershipResolver;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final CoreMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public SubjectDto createSubject(CallerContext caller, CreateSubjectRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        UUID ownerId = resolveOwnerId(caller, request.teacherOwnerId());
        String name = normalizeName(request.name());
        String nameNormalized = name.toLowerCase(Locale.ROOT);

        if (subjectRepository.existsByTenantIdAndTeacherOwnerIdAndNameNormalized(caller.tenantId(), ownerId, nameNormalized)) {
            throw new ConflictException("Subject name already exists for this owner");
        }

        Subject subject = new Subject();
        subject.setTenantId(caller.tenantId());
        subject.setTeacherOwnerId(ownerId);
        subject.setName(name);
        subject.setNameNormalized(nameNormalized);
        subject.setDescription(request.description());
        Subject saved = subjectRepository.save(subject);

        auditService.record(caller, "subject.create", "subject", saved.getId(),
                Map.of("teacherOwnerId", ownerId, "name", name));
        log.info("Subject {} '{}' created in tenant {} for owner {}", saved.getId(), name, caller.tenantId(), ownerId);
        return SubjectDto.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubjectDto> listSubjects(CallerContext caller, UUID teacherId, boolean includeArchived) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        List<Subject> subjects = caller.isContentManager() && !caller.isTenantAdmin()
                ? subjectRepository.findAllByTenantIdAndTeacherOwnerIdOrderByNameAsc(caller.tenantId(), caller.userId())
                : teacherId != null
                ? subjectRepository.findAllByTenantIdAndTeacherOwnerIdOrderByNameAsc(caller.tenantId(), teacherId)
                : subjectRepository.findAllByTenantIdOrderByNameAsc(caller.tenantId());

        return subjects.stream()
                .filter(subject -> includeArchived || !subject.isArchived())
                .sorted(Comparator.comparing(Subject::isArchived))
                .map(SubjectDto::from)
                .toList();
    }

    @Override
    @Transactional
    public SubjectDto updateSubject(CallerContext caller, UUID subjectId, UpdateSubjectRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = getSubjectForCaller(caller, subjectId);

        if (request.name() != null) {
            String name = normalizeName(request.name());
            String nameNormalized = name.toLowerCase(Locale.ROOT);
            if (!nameNormalized.equals(subject.getNameNormalized())
                    && subjectRepository.existsByTenantIdAndTeacherOwnerIdAndNameNormalized(
                    subject.getTenantId(), subject.getTeacherOwnerId(), nameNormalized)) {
                throw new ConflictException("Subject name already exists for this owner");
            }
            subject.setName(name);
            subject.setNameNormalized(nameNormalized);
        }
        if (request.archived() != null) {
            subject.setArchived(request.archived());
        }

        auditService.record(caller, "subject.update", "subject", subject.getId(),
                Map.of("name", subject.getName(), "archived", subject.isArchived()));
        return SubjectDto.from(subject);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubjectEnrollmentDto> listEnrollments(CallerContext caller, UUID subjectId) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = getSubjectForCaller(caller, subjectId);
        return enrollmentRepository.findAllByTenantIdAndSubjectIdOrderByCreatedAtAsc(subject.getTenantId(), subject.getId())
                .stream()
                .map(SubjectEnrollmentDto::from)
                .toList();
    }

    @Override
    @Transactional
    public EnrollmentChangeResponse enrollStudent(CallerContext caller, UUID subjectId, EnrollStudentRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = assertSubjectAccess(caller, subjectId);
        UUID studentId = request.studentId();
        if (!membershipResolver.isActiveStudent(caller.tenantId(), studentId)) {
            throw new ValidationException("Student must be an active student member of this tenant");
        }

        SubjectEnrollment enrollment = enrollmentRepository
                .findByTenantIdAndSubjectIdAndStudentId(caller.tenantId(), subjectId, studentId)
                .orElse(null);

        boolean created = enrollment == null;
        boolean reactivated = false;
        if (created) {
            enrollment = new SubjectEnrollment();
            enrollment.setTenantId(caller.tenantId());
            enrollment.setSubjectId(subjectId);
            enrollment.setStudentId(studentId);
            enrollment.setStatus(EnrollmentStatus.ACTIVE);
            enrollment.setAutoAssignFuture(request.autoAssignFuture() == null || request.autoAssignFuture());
            enrollment.setEnrolledByUserId(caller.userId());
            enrollment = enrollmentRepository.saveAndFlush(enrollment);
        } else {
            reactivated = enrollment.getStatus() == EnrollmentStatus.COMPLETED;
            activate(enrollment);
            if (request.autoAssignFuture() != null) {
                enrollment.setAutoAssignFuture(request.autoAssignFuture());
            }
        }

        MaterializationResult assignments = assignmentMaterializer.onEnrollmentActivated(subject, enrollment);

        if (created) {
            metricsService.incrementEnrollmentCreated();
        }
        if (reactivated) {
            metricsService.incrementEnrollmentReactivated();
        }
        auditService.record(caller, "subject.enroll", "subject_enrollment", enrollment.getId(),
                enrollmentAudit(subject, enrollment, null, assignments));
        return new EnrollmentChangeResponse(SubjectEnrollmentDto.from(enrollment),
                assignments.lessonCreated(), assignments.examCreated());
    }

    @Override
    @Transactional
    public EnrollmentChangeResponse updateEnrollment(CallerContext caller, UUID subjectId, UUID studentId,
                                                     UpdateEnrollmentRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = getSubjectForCaller(caller, subjectId);

        SubjectEnrollment enrollment = enrollmentRepository
                .findByTenantIdAndSubjectIdAndStudentId(caller.tenantId(), subjectId, studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Subject enrollment not found"));
        EnrollmentStatus previousStatus = enrollment.getStatus();

        if (request.autoAssignFuture() != null) {
            enrollment.setAutoAssignFuture(request.autoAssignFuture());
        }
        if (request.status() == EnrollmentStatus.COMPLETED) {
            enrollment.setStatus(EnrollmentStatus.COMPLETED);
            enrollment.setCompletedAt(Instant.now(clock));
            enrollment.setCompletedByUserId(caller.userId());
        } else if (request.status() == EnrollmentStatus.ACTIVE) {
            activate(enrollment);
        }

        MaterializationResult assignments = MaterializationResult.EMPTY;
        if (enrollment.isActive()) {
            assignments = assignmentMaterializer.onEnrollmentActivated(subject, enrollment);
        }

        if (enrollment.getStatus() == EnrollmentStatus.COMPLETED && previousStatus != EnrollmentStatus.COMPLETED) {
            metricsService.incrementEnrollmentCompleted();
        }
        if (enrollment.isActive() && previousStatus == EnrollmentStatus.COMPLETED) {
            metricsService.incrementEnrollmentReactivated();
        }

        String action = enrollment.isActive() ? "subject.enroll" : "subject.complete";
        auditService.record(caller, action, "subject_enrollment", enrollment.getId(),
                enrollmentAudit(subject, enrollment, previousStatus, assignments));
        return new EnrollmentChangeResponse(SubjectEnrollmentDto.from(enrollment),
                assignments.lessonCreated(), assignments.examCreated());
    }

    @Override
    @Transactional(readOnly = true)
    public Subject requireManagedSubject(CallerContext caller, UUID subjectId) {
        return getSubjectForCaller(caller, subjectId);
    }

    @Override
    @Transactional(readOnly = true)
    public Subject assertSubjectAccess(CallerContext caller, UUID subjectId) {
        Subject subject = getSubjectForCaller(caller, subjectId);
        if (subject.isArchived()) {
            throw new ValidationException("Subject is archived");
        }
        return subject;
    }

    @Override
    @Transactional
    public ManualEnrollmentResult ensureEnrollmentForManualAssignment(CallerContext caller, Subject subject, UUID studentId) {
        UUID candidateId = UUID.randomUUID();
        int inserted = enrollmentRepository.insertManualEnrollmentIfAbsent(
                candidateId.toString(),
                subject.getTenantId().toString(),
                subject.getId().toString(),
                studentId.toString(),
                caller.userId().toString()
        );
        if (inserted == 0) {
            UUID existingId = enrollmentRepository
                    .findByTenantIdAndSubjectIdAndStudentId(subject.getTenantId(), subject.getId(), studentId)
                    .map(SubjectEnrollment::getId)
                    .orElseThrow(() -> new IllegalStateException(
                            "Enrollment for student " + studentId + " in subject " + subject.getId() + " vanished"));
            return new ManualEnrollmentResult(existingId, false);
        }

        metricsService.incrementEnrollmentCreated();
        auditService.record(caller, "subject.enroll", "subject_enrollment", candidateId, Map.of(
                "subjectId", subject.getId(),
                "studentId", studentId,
                "teacherOwnerId", subject.getTeacherOwnerId(),
                "autoAssignFuture", false,
                "source", "manual_assignment"
        ));
        log.info("Enrolled student {} in subject {} through manual assignment", studentId, subject.getId());
        return new ManualEnrollmentResult(candidateId, true);
    }

    private Subject getSubjectForCaller(CallerContext caller, UUID subjectId) {
        Subject subject = subjectRepository.findByIdAndTenantId(subjectId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Subject " + subjectId + " not found"));
        if (caller.isStudent() && !caller.platformAdmin()) {
            throw new ForbiddenException("Students cannot manage subjects");
        }
        accessPolicy.requireOwnerOrTenantAdmin(caller, subject.getTeacherOwnerId(), "Cannot access another owner's subject");
        return subject;
    }

    private UUID resolveOwnerId(CallerContext caller, UUID requestedOwnerId) {
        if (caller.isContentManager()) {
            return caller.userId();
        }
        if (requestedOwnerId == null) {
            throw new ValidationException("teacherOwnerId is required for admin subject creation");
        }
        if (!membershipResolver.isActiveContentManager(caller.tenantId(), requestedOwnerId)) {
            throw new ValidationException("Teacher owner must be an active teacher/parent/tutor member in this tenant");
        }
        return requestedOwnerId;
    }

    private static String normalizeName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw new ValidationException("Subject name is required");
        }
        return name;
    }

    private static void activate(SubjectEnrollment enrollment) {
        enrollment.setStatus(EnrollmentStatus.ACTIVE);
        enrollment.setCompletedAt(null);
        enrollment.setCompletedByUserId(null);
    }

    private static Map<String, Object> enrollmentAudit(Subject subject, SubjectEnrollment enrollment,
                                                       EnrollmentStatus previousStatus, MaterializationResult assignments) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("subjectId", subject.getId());
        metadata.put("studentId", enrollment.getStudentId());
        metadata.put("teacherOwnerId", subject.getTeacherOwnerId());
        if (previousStatus != null) {
            metadata.put("previousStatus", previousStatus.name());
        }
        metadata.put("status", enrollment.getStatus().name());
        metadata.put("autoAssignFuture", enrollment.isAutoAssignFuture());
        metadata.put("assignedLessons", assignments.lessonCreated());
        metadata.put("assignedExams", assignments.examCreated());
        return metadata;
    }
}
