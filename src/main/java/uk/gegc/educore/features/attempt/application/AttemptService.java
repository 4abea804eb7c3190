package uk.gegc.educore.features.attempt.application;

import uk.gegc.educore.features.attempt.api.dto.AttemptDto;
import uk.gegc.educore.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.educore.features.attempt.api.dto.SaveResponsesRequest;
import uk.gegc.educore.features.attempt.api.dto.SaveResponsesResponse;
import uk.gegc.educore.features.attempt.api.dto.SubmissionDto;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.UUID;

public interface AttemptService {

    /**
     * Starts an attempt on an exam assignment. Fails with a conflict while another attempt
     * is in progress or once {@code maxAttempts} attempts exist.
     */
    AttemptDto createAttempt(CallerContext caller, UUID assignmentId);

    SaveResponsesResponse saveResponses(CallerContext caller, UUID attemptId, SaveResponsesRequest request);

    /**
     * Moves the attempt out of progress, grades it and stores the result. Exactly one of
     * any number of concurrent submits succeeds.
     */
    SubmissionDto submitAttempt(CallerContext caller, UUID attemptId);

    AttemptResultDto getAttemptResult(CallerContext caller, UUID attemptId);
}
