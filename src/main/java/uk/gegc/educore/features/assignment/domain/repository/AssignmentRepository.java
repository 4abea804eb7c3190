package uk.gegc.educore.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.assignment.domain.model.Assignment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, UUID> {

    Optional<Assignment> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Assignment> findAllByTenantIdAndAssigneeStudentIdOrderByCreatedAtDesc(UUID tenantId, UUID assigneeStudentId);

    boolean existsByTenantIdAndAssigneeStudentIdAndExamId(UUID tenantId, UUID assigneeStudentId, UUID examId);

    boolean existsByTenantIdAndAssigneeStudentIdAndLessonId(UUID tenantId, UUID assigneeStudentId, UUID lessonId);

    /**
     * Inserts an auto-assigned lesson unless a row with the same {@code auto_assign_key} exists.
     *
     * @return number of rows inserted, 0 or 1
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT IGNORE INTO assignments
                (id, tenant_id, assignee_student_id, assigned_by_teacher_id, lesson_id, exam_id,
                 assignment_source, subject_enrollment_id, assignment_type, max_attempts, due_at,
                 auto_assign_key, created_at)
            VALUES
                (:id, :tenantId, :studentId, :teacherId, :lessonId, NULL,
                 'SUBJECT_AUTO', :enrollmentId, :assignmentType, :maxAttempts, NULL,
                 :autoAssignKey, CURRENT_TIMESTAMP)
            """, nativeQuery = true)
    int insertAutoLessonAssignmentIfAbsent(@Param("id") String id,
                                           @Param("tenantId") String tenantId,
                                           @Param("studentId") String studentId,
                                           @Param("teacherId") String teacherId,
                                           @Param("lessonId") String lessonId,
                                           @Param("enrollmentId") String enrollmentId,
                                           @Param("assignmentType") String assignmentType,
                                           @Param("maxAttempts") int maxAttempts,
                                           @Param("autoAssignKey") String autoAssignKey);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT IGNORE INTO assignments
                (id, tenant_id, assignee_student_id, assigned_by_teacher_id, lesson_id, exam_id,
                 assignment_source, subject_enrollment_id, assignment_type, max_attempts, due_at,
                 auto_assign_key, created_at)
            VALUES
                (:id, :tenantId, :studentId, :teacherId, NULL, :examId,
                 'SUBJECT_AUTO', :enrollmentId, :assignmentType, :maxAttempts, NULL,
                 :autoAssignKey, CURRENT_TIMESTAMP)
            """, nativeQuery = true)
    int insertAutoExamAssignmentIfAbsent(@Param("id") String id,
                                         @Param("tenantId") String tenantId,
                                         @Param("studentId") String studentId,
                                         @Param("teacherId") String teacherId,
                                         @Param("examId") String examId,
                                         @Param("enrollmentId") String enrollmentId,
                                         @Param("assignmentType") String assignmentType,
                                         @Param("maxAttempts") int maxAttempts,
                                         @Param("autoAssignKey") String autoAssignKey);
}
