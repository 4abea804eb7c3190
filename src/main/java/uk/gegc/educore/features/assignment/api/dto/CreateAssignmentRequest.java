package uk.gegc.educore.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "CreateAssignmentRequest", description = "Assigns one lesson or one exam to a set of students")
public record CreateAssignmentRequest(
        @Schema(description = "Lesson to assign; mutually exclusive with examId")
        UUID lessonId,

        @Schema(description = "Exam to assign; mutually exclusive with lessonId")
        UUID examId,

        @Schema(description = "Students to assign; duplicates are ignored", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one student ID is required")
        List<@NotNull UUID> studentIds,

        @Schema(description = "Optional due date", example = "2026-11-01T09:00:00Z")
        Instant dueAt,

        @Schema(description = "Defaults to PRACTICE")
        AssignmentType assignmentType,

        @Schema(description = "Defaults to 1 for assessments and 3 for practice", example = "3")
        @Min(value = 1, message = "maxAttempts must be at least 1")
        @Max(value = 20, message = "maxAttempts must be at most 20")
        Integer maxAttempts
) {
}
