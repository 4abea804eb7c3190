package uk.gegc.educore.features.attempt.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.educore.features.attempt.domain.model.AttemptResponse;

import java.util.List;
import java.util.UUID;

@Repository
public interface AttemptResponseRepository extends JpaRepository<AttemptResponse, UUID> {

    List<AttemptResponse> findAllByAttemptId(UUID attemptId);

    List<AttemptResponse> findAllByAttemptIdOrderByQuestionIdAsc(UUID attemptId);
}
