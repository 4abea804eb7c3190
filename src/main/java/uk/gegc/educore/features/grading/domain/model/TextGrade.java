package uk.gegc.educore.features.grading.domain.model;

public record TextGrade(int scorePercent, String feedback) {
}
