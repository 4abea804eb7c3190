package uk.gegc.educore.features.subject.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "CreateSubjectRequest", description = "Payload for creating a subject")
public record CreateSubjectRequest(
        @Schema(description = "Subject name, unique per owner (case-insensitive)", example = "Algebra I")
        @NotBlank(message = "Subject name is required")
        @Size(max = 120, message = "Subject name must be at most 120 characters")
        String name,

        @Schema(description = "Optional description")
        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        @Schema(description = "Owning teacher; required when a tenant admin creates the subject")
        UUID teacherOwnerId
) {
}
