package uk.gegc.educore.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;

public record ResponseResultDto(String questionId, JsonNode answer, GradedQuestion grading) {
}
