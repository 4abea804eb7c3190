package uk.gegc.educore.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "CreateAttemptRequest")
public record CreateAttemptRequest(
        @Schema(description = "Exam assignment to start an attempt for", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "assignmentId is required")
        UUID assignmentId
) {
}
