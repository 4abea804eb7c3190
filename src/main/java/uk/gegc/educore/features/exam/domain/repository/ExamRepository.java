package uk.gegc.educore.features.exam.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.exam.domain.model.Exam;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamRepository extends JpaRepository<Exam, UUID> {

    Optional<Exam> findByIdAndTenantIdAndDeletedFalse(UUID id, UUID tenantId);

    List<Exam> findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(UUID subjectId);

    List<Exam> findAllByTenantIdAndDeletedFalseOrderByCreatedAtDesc(UUID tenantId);

    @Query("""
            SELECT e FROM Exam e, Subject s
            WHERE s.id = e.subjectId
              AND e.tenantId = :tenantId
              AND s.teacherOwnerId = :ownerId
              AND e.deleted = false
            ORDER BY e.createdAt DESC
            """)
    List<Exam> findAllOwnedBy(@Param("tenantId") UUID tenantId, @Param("ownerId") UUID ownerId);

    List<Exam> findAllByIdInAndDeletedFalseOrderByCreatedAtDesc(Collection<UUID> ids);
}
