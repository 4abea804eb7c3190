package uk.gegc.educore.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;
import uk.gegc.educore.features.grading.domain.model.GradingSummary;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "AttemptResultDto", description = "An attempt with its answers and per-question grading")
public record AttemptResultDto(
        UUID id,
        UUID assignmentId,
        UUID examId,
        String examTitle,
        UUID studentId,
        AttemptStatus status,
        Integer scorePercent,
        Instant startedAt,
        Instant submittedAt,
        Instant gradedAt,
        GradingSummary gradingSummary,
        List<ResponseResultDto> responses
) {
}
