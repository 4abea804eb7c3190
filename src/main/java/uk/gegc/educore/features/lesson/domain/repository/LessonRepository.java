package uk.gegc.educore.features.lesson.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.lesson.domain.model.Lesson;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, UUID> {

    Optional<Lesson> findByIdAndTenantIdAndDeletedFalse(UUID id, UUID tenantId);

    List<Lesson> findAllBySubjectIdAndDeletedFalseOrderByCreatedAtAsc(UUID subjectId);

    List<Lesson> findAllByTenantIdAndSubjectIdAndDeletedFalseOrderByCreatedAtAsc(UUID tenantId, UUID subjectId);
}
