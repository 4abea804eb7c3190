package uk.gegc.educore.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "SaveResponsesRequest")
public record SaveResponsesRequest(
        @NotNull(message = "responses is required")
        List<@Valid @NotNull ResponseEntry> responses
) {
}
