package uk.gegc.educore.features.attempt.api.dto;

import java.util.UUID;

public record SaveResponsesResponse(UUID attemptId, int saved) {
}
