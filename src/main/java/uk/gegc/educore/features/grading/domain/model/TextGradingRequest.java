package uk.gegc.educore.features.grading.domain.model;

public record TextGradingRequest(String prompt, String rubric, String answer) {
}
