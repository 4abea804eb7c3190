package uk.gegc.educore.features.subject.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubjectEnrollmentRepository extends JpaRepository<SubjectEnrollment, UUID> {

    Optional<SubjectEnrollment> findByTenantIdAndSubjectIdAndStudentId(UUID tenantId, UUID subjectId, UUID studentId);

    List<SubjectEnrollment> findAllByTenantIdAndSubjectIdOrderByCreatedAtAsc(UUID tenantId, UUID subjectId);

    List<SubjectEnrollment> findAllBySubjectIdAndStatusAndAutoAssignFutureTrue(UUID subjectId, EnrollmentStatus status);

    /**
     * Creates an active enrollment without auto-assignment unless one already exists for the
     * (tenant, subject, student) key.
     *
     * @return 1 when a row was inserted, 0 when the student was already enrolled
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT IGNORE INTO subject_enrollments
                (id, tenant_id, subject_id, student_id, status, auto_assign_future,
                 enrolled_by_user_id, created_at, updated_at)
            VALUES
                (:id, :tenantId, :subjectId, :studentId, 'ACTIVE', FALSE,
                 :enrolledBy, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            """, nativeQuery = true)
    int insertManualEnrollmentIfAbsent(@Param("id") String id,
                                       @Param("tenantId") String tenantId,
                                       @Param("subjectId") String subjectId,
                                       @Param("studentId") String studentId,
                                       @Param("enrolledBy") String enrolledBy);
}
