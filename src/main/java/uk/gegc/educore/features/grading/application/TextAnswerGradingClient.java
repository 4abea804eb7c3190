package uk.gegc.educore.features.grading.application;

import uk.gegc.educore.features.grading.domain.model.TextGrade;
import uk.gegc.educore.features.grading.domain.model.TextGradingRequest;
import uk.gegc.educore.shared.exception.AiServiceException;

/**
 * Remote grader for free-text answers. Calls may be slow and may fail.
 */
public interface TextAnswerGradingClient {

    /**
     * @return a score already clamped to 0..100 and non-blank feedback
     * @throws AiServiceException when the grader is unavailable or its reply cannot be used
     */
    TextGrade gradeTextAnswer(TextGradingRequest request);
}
