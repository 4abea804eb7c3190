package uk.gegc.educore.features.attempt.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AttemptRepository extends JpaRepository<Attempt, UUID> {

    Optional<Attempt> findByIdAndTenantId(UUID id, UUID tenantId);

    boolean existsByAssignmentIdAndStudentIdAndStatus(UUID assignmentId, UUID studentId, AttemptStatus status);

    long countByAssignmentIdAndStudentId(UUID assignmentId, UUID studentId);

    List<Attempt> findAllByAssignmentIdAndStudentIdOrderByStartedAtAsc(UUID assignmentId, UUID studentId);

    @Query("""
            SELECT a.assignmentId AS assignmentId, COUNT(a) AS attemptCount
            FROM Attempt a
            WHERE a.assignmentId IN :assignmentIds
            GROUP BY a.assignmentId
            """)
    List<AttemptCountProjection> countByAssignmentIds(@Param("assignmentIds") Collection<UUID> assignmentIds);

    /**
     * Moves an attempt out of {@code IN_PROGRESS}. Only one caller can win this update;
     * every other concurrent submit of the same attempt sees 0 rows affected.
     *
     * @return 1 if the attempt was transitioned, 0 otherwise
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Attempt a
            SET a.status = uk.gegc.educore.features.attempt.domain.model.AttemptStatus.SUBMITTED,
                a.submittedAt = :submittedAt
            WHERE a.id = :attemptId
              AND a.tenantId = :tenantId
              AND a.studentId = :studentId
              AND a.status = uk.gegc.educore.features.attempt.domain.model.AttemptStatus.IN_PROGRESS
            """)
    int markSubmitted(@Param("attemptId") UUID attemptId,
                      @Param("tenantId") UUID tenantId,
                      @Param("studentId") UUID studentId,
                      @Param("submittedAt") Instant submittedAt);
}
