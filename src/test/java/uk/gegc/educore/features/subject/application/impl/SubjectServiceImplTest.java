package uk.gegc.educore.features.subject.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.educore.features.assignment.application.AssignmentMaterializer;
import uk.gegc.educore.features.assignment.application.MaterializationResult;
import uk.gegc.educore.features.subject.api.dto.CreateSubjectRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollStudentRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollmentChangeResponse;
import uk.gegc.educore.features.subject.api.dto.SubjectDto;
import uk.gegc.educore.features.subject.api.dto.UpdateEnrollmentRequest;
import uk.gegc.educore.features.subject.application.ManualEnrollmentResult;
import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;
import uk.gegc.educore.features.subject.domain.repository.SubjectEnrollmentRepository;
import uk.gegc.educore.features.subject.domain.repository.SubjectRepository;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ConflictException;
import uk.gegc.educore.shared.exception.ForbiddenException;
import uk.gegc.educore.shared.exception.ValidationException;
import uk.gegc.educore.shared.metrics.CoreMetricsService;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;
import uk.gegc.educore.shared.security.RoleKey;
import uk.gegc.educore.shared.security.TenantMembershipResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubjectServiceImpl")
class SubjectServiceImplTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID TEACHER = UUID.randomUUID();
    private static final UUID STUDENT = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private SubjectRepository subjectRepository;
    @Mock
    private SubjectEnrollmentRepository enrollmentRepository;
    @Mock
    private AssignmentMaterializer assignmentMaterializer;
    @Mock
    private TenantMembershipResolver membershipResolver;
    @Mock
    private AuditService auditService;
    @Mock
    private CoreMetricsService metricsService;

    private SubjectServiceImpl service;

    private final CallerContext teacher = new CallerContext(TEACHER, TENANT, RoleKey.TEACHER, false);
    private final CallerContext admin = new CallerContext(UUID.randomUUID(), TENANT, RoleKey.SCHOOL_ADMIN, false);

    @BeforeEach
    void setUp() {
        service = new SubjectServiceImpl(subjectRepository, enrollmentRepository, assignmentMaterializer,
                membershipResolver, new AccessPolicy(), auditService, metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Subject subject(boolean archived) {
        Subject subject = new Subject();
        subject.setId(UUID.randomUUID());
        subject.setTenantId(TENANT);
        subject.setTeacherOwnerId(TEACHER);
        subject.setName("Chemistry");
        subject.setNameNormalized("chemistry");
        subject.setArchived(archived);
        return subject;
    }

    private SubjectEnrollment enrollment(Subject subject, EnrollmentStatus status) {
        SubjectEnrollment enrollment = new SubjectEnrollment();
        enrollment.setId(UUID.randomUUID());
        enrollment.setTenantId(TENANT);
        enrollment.setSubjectId(subject.getId());
        enrollment.setStudentId(STUDENT);
        enrollment.setEnrolledByUserId(TEACHER);
        enrollment.setStatus(status);
        if (status == EnrollmentStatus.COMPLETED) {
            enrollment.setCompletedAt(NOW.minusSeconds(3600));
            enrollment.setCompletedByUserId(TEACHER);
        }
        return enrollment;
    }

    @Nested
    @DisplayName("createSubject")
    class CreateSubject {

        @Test
        @DisplayName("a teacher owns the subject it creates, with a trimmed name")
        void teacherOwnsSubject() {
            when(subjectRepository.existsByTenantIdAndTeacherOwnerIdAndNameNormalized(TENANT, TEACHER, "algebra i"))
                    .thenReturn(false);
            when(subjectRepository.save(any(Subject.class))).thenAnswer(invocation -> {
                Subject saved = invocation.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });

            SubjectDto dto = service.createSubject(teacher, new CreateSubjectRequest("  Algebra I ", null, UUID.randomUUID()));

            assertThat(dto.name()).isEqualTo("Algebra I");
            assertThat(dto.teacherOwnerId()).isEqualTo(TEACHER);
            verify(auditService).record(eq(teacher), eq("subject.create"), eq("subject"), eq(dto.id()), anyMap());
        }

        @Test
        @DisplayName("duplicate names for the same owner conflict")
        void duplicateName() {
            when(subjectRepository.existsByTenantIdAndTeacherOwnerIdAndNameNormalized(TENANT, TEACHER, "algebra i"))
                    .thenReturn(true);

            assertThatThrownBy(() -> service.createSubject(teacher, new CreateSubjectRequest("ALGEBRA I", null, null)))
                    .isInstanceOf(ConflictException.class);
            verify(subjectRepository, never()).save(any());
        }

        @Test
        @DisplayName("admins must name an active teacher as owner")
        void adminNeedsOwner() {
            assertThatThrownBy(() -> service.createSubject(admin, new CreateSubjectRequest("Physics", null, null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("teacherOwnerId");

            UUID stranger = UUID.randomUUID();
            when(membershipResolver.isActiveContentManager(TENANT, stranger)).thenReturn(false);
            assertThatThrownBy(() -> service.createSubject(admin, new CreateSubjectRequest("Physics", null, stranger)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("students are rejected")
        void studentsRejected() {
            CallerContext student = new CallerContext(STUDENT, TENANT, RoleKey.STUDENT, false);

            assertThatThrownBy(() -> service.createSubject(student, new CreateSubjectRequest("Art", null, null)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("enrollStudent")
    class EnrollStudent {

        @Test
        @DisplayName("a new enrollment is active, auto-assigns by default and materializes existing content")
        void newEnrollment() {
            Subject subject = subject(false);
            when(subjectRepository.findByIdAndTenantId(subject.getId(), TENANT)).thenReturn(Optional.of(subject));
            when(membershipResolver.isActiveStudent(TENANT, STUDENT)).thenReturn(true);
            when(enrollmentRepository.findByTenantIdAndSubjectIdAndStudentId(TENANT, subject.getId(), STUDENT))
                    .thenReturn(Optional.empty());
            when(enrollmentRepository.saveAndFlush(any(SubjectEnrollment.class))).thenAnswer(invocation -> {
                SubjectEnrollment saved = invocation.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });
            when(assignmentMaterializer.onEnrollmentActivated(eq(subject), any(SubjectEnrollment.class)))
                    .thenReturn(new MaterializationResult(2, 2, 1, 1));

            EnrollmentChangeResponse response = service.enrollStudent(teacher, subject.getId(),
                    new EnrollStudentRequest(STUDENT, null));

            assertThat(response.enrollment().status()).isEqualTo(EnrollmentStatus.ACTIVE);
            assertThat(response.enrollment().autoAssignFuture()).isTrue();
            assertThat(response.lessonsCreated()).isEqualTo(2);
            assertThat(response.examsCreated()).isEqualTo(1);
            verify(metricsService).incrementEnrollmentCreated();
            verify(metricsService, never()).incrementEnrollmentReactivated();
        }

        @Test
        @DisplayName("re-enrolling a completed student reactivates the same row")
        void reactivates() {
            Subject subject = subject(false);
            SubjectEnrollment existing = enrollment(subject, EnrollmentStatus.COMPLETED);
            when(subjectRepository.findByIdAndTenantId(subject.getId(), TENANT)).thenReturn(Optional.of(subject));
            when(membershipResolver.isActiveStudent(TENANT, STUDENT)).thenReturn(true);
            when(enrollmentRepository.findByTenantIdAndSubjectIdAndStudentId(TENANT, subject.getId(), STUDENT))
                    .thenReturn(Optional.of(existing));
            when(assignmentMaterializer.onEnrollmentActivated(subject, existing)).thenReturn(MaterializationResult.EMPTY);

            EnrollmentChangeResponse response = service.enrollStudent(teacher, subject.getId(),
                    new EnrollStudentRequest(STUDENT, false));

            assertThat(response.enrollment().id()).isEqualTo(existing.getId());
            assertThat(existing.getStatus()).isEqualTo(EnrollmentStatus.ACTIVE);
            assertThat(existing.getCompletedAt()).isNull();
            assertThat(existing.getCompletedByUserId()).isNull();
            assertThat(existing.isAutoAssignFuture()).isFalse();
            verify(enrollmentRepository, never()).saveAndFlush(any());
            verify(metricsService).incrementEnrollmentReactivated();
        }

        @Test
        @DisplayName("archived subjects cannot take enrollments")
        void archivedSubject() {
            Subject subject = subject(true);
            when(subjectRepository.findByIdAndTenantId(subject.getId(), TENANT)).thenReturn(Optional.of(subject));

            assertThatThrownBy(() -> service.enrollStudent(teacher, subject.getId(), new EnrollStudentRequest(STUDENT, null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Subject is archived");
            verifyNoInteractions(assignmentMaterializer);
        }

        @Test
        @DisplayName("another teacher's subject is forbidden")
        void notOwner() {
            Subject subject = subject(false);
            subject.setTeacherOwnerId(UUID.randomUUID());
            when(subjectRepository.findByIdAndTenantId(subject.getId(), TENANT)).thenReturn(Optional.of(subject));

            assertThatThrownBy(() -> service.enrollStudent(teacher, subject.getId(), new EnrollStudentRequest(STUDENT, null)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("updateEnrollment")
    class UpdateEnrollment {

        @Test
        @DisplayName("completing stamps the time and actor without materializing")
        void complete() {
            Subject subject = subject(false);
            SubjectEnrollment existing = enrollment(subject, EnrollmentStatus.ACTIVE);
            when(subjectRepository.findByIdAndTenantId(subject.getId(), TENANT)).thenReturn(Optional.of(subject));
            when(enrollmentRepository.findByTenantIdAndSubjectIdAndStudentId(TENANT, subject.getId(), STUDENT))
                    .thenReturn(Optional.of(existing));

            EnrollmentChangeResponse response = service.updateEnrollment(teacher, subject.getId(), STUDENT,
                    new UpdateEnrollmentRequest(EnrollmentStatus.COMPLETED, null));

            assertThat(response.enrollment().completedAt()).isEqualTo(NOW);
            assertThat(existing.getCompletedByUserId()).isEqualTo(TEACHER);
            verifyNoInteractions(assignmentMaterializer);
            verify(metricsService).incrementEnrollmentCompleted();
            verify(auditService).record(eq(teacher), eq("subject.complete"), anyString(), eq(existing.getId()), anyMap());
        }
    }

    @Nested
    @DisplayName("ensureEnrollmentForManualAssignment")
    class ManualEnrollment {

        @Test
        @DisplayName("creates an enrollment with auto-assignment off when none exists")
        void creates() {
            Subject subject = subject(false);
            ArgumentCaptor<String> idCaptor = ArgumentCaptor.forClass(String.class);
            when(enrollmentRepository.insertManualEnrollmentIfAbsent(idCaptor.capture(), eq(TENANT.toString()),
                    eq(subject.getId().toString()), eq(STUDENT.toString()), eq(TEACHER.toString()))).thenReturn(1);

            ManualEnrollmentResult result = service.ensureEnrollmentForManualAssignment(teacher, subject, STUDENT);

            assertThat(result.created()).isTrue();
            assertThat(result.enrollmentId().toString()).isEqualTo(idCaptor.getValue());
            verify(metricsService).incrementEnrollmentCreated();
        }

        @Test
        @DisplayName("returns the existing enrollment untouched")
        void existing() {
            Subject subject = subject(false);
            SubjectEnrollment existing = enrollment(subject, EnrollmentStatus.COMPLETED);
            when(enrollmentRepository.insertManualEnrollmentIfAbsent(anyString(), anyString(), anyString(),
                    anyString(), anyString())).thenReturn(0);
            when(enrollmentRepository.findByTenantIdAndSubjectIdAndStudentId(TENANT, subject.getId(), STUDENT))
                    .thenReturn(Optional.of(existing));

            ManualEnrollmentResult result = service.ensureEnrollmentForManualAssignment(teacher, subject, STUDENT);

            assertThat(result).isEqualTo(new ManualEnrollmentResult(existing.getId(), false));
            assertThat(existing.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
            verifyNoInteractions(metricsService, auditService);
        }
    }
}
