package uk.gegc.educore.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;
import uk.gegc.educore.features.grading.domain.model.GradingSummary;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SubmissionDto", description = "Outcome of submitting an attempt")
public record SubmissionDto(
        UUID id,

        @Schema(description = "GRADED, or NEEDS_REVIEW when any answer needs a human", example = "GRADED")
        AttemptStatus status,

        @Schema(description = "Rounded mean of per-question scores", example = "75")
        Integer scorePercent,

        Instant submittedAt,
        Instant gradedAt,
        GradingSummary gradingSummary
) {
}
