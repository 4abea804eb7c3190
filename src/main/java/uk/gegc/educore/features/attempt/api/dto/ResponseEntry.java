package uk.gegc.educore.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One autosaved answer. {@code answer} may be any JSON value including {@code null},
 * but it must be present.
 */
@Schema(name = "ResponseEntry")
public record ResponseEntry(
        @Schema(description = "Normalized question id", example = "q1")
        String questionId,

        @Schema(description = "Answer as JSON: a choice string, a boolean, or free text")
        JsonNode answer
) {
}
