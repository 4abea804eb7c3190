package uk.gegc.educore.features.subject.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.subject.domain.model.Subject;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubjectRepository extends JpaRepository<Subject, UUID> {

    Optional<Subject> findByIdAndTenantId(UUID id, UUID tenantId);

    boolean existsByTenantIdAndTeacherOwnerIdAndNameNormalized(UUID tenantId, UUID teacherOwnerId, String nameNormalized);

    List<Subject> findAllByTenantIdOrderByNameAsc(UUID tenantId);

    List<Subject> findAllByTenantIdAndTeacherOwnerIdOrderByNameAsc(UUID tenantId, UUID teacherOwnerId);
}
