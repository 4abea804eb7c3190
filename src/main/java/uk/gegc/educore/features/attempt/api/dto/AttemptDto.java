package uk.gegc.educore.features.attempt.api.dto;

import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.UUID;

public record AttemptDto(
        UUID id,
        UUID assignmentId,
        UUID examId,
        UUID studentId,
        AttemptStatus status,
        Integer scorePercent,
        Instant startedAt,
        Instant submittedAt,
        Instant gradedAt
) {

    public static AttemptDto from(Attempt attempt) {
        return new AttemptDto(
                attempt.getId(),
                attempt.getAssignmentId(),
                attempt.getExamId(),
                attempt.getStudentId(),
                attempt.getStatus(),
                attempt.getScorePercent(),
                attempt.getStartedAt(),
                attempt.getSubmittedAt(),
                attempt.getGradedAt()
        );
    }
}
