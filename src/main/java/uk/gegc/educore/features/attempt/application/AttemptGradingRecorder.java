package uk.gegc.educore.features.attempt.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptResponse;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;
import uk.gegc.educore.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.educore.features.attempt.domain.repository.AttemptResponseRepository;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;
import uk.gegc.educore.features.grading.domain.model.GradingOutcome;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Persists a grading outcome in one transaction: every per-question grading, then the
 * attempt's final status, score and summary.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttemptGradingRecorder {

    private final AttemptRepository attemptRepository;
    private final AttemptResponseRepository responseRepository;
    private final AttemptJson attemptJson;

    @Transactional
    public Attempt record(UUID attemptId, GradingOutcome outcome, Map<String, JsonNode> answers, Instant gradedAt) {
        Attempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt not found"));

        Map<String, AttemptResponse> existing = responseRepository.findAllByAttemptId(attemptId).stream()
                .collect(Collectors.toMap(AttemptResponse::getQuestionId, Function.identity()));

        List<AttemptResponse> toSave = new ArrayList<>();
        for (GradedQuestion graded : outcome.perQuestion()) {
            AttemptResponse response = existing.get(graded.questionId());
            if (response == null) {
                response = new AttemptResponse();
                response.setAttemptId(attemptId);
                response.setQuestionId(graded.questionId());
                JsonNode answer = answers.get(graded.questionId());
                response.setAnswerJson(answer != null ? attemptJson.write(answer) : null);
            }
            response.setGradingJson(attemptJson.write(graded));
            toSave.add(response);
        }
        responseRepository.saveAll(toSave);

        attempt.setStatus(outcome.needsReview() ? AttemptStatus.NEEDS_REVIEW : AttemptStatus.GRADED);
        attempt.setScorePercent(outcome.scorePercent());
        attempt.setGradedAt(gradedAt);
        attempt.setGradingSummaryJson(attemptJson.write(outcome.summary()));
        log.info("Attempt {} graded: status={}, score={}", attemptId, attempt.getStatus(), outcome.scorePercent());
        return attempt;
    }
}
