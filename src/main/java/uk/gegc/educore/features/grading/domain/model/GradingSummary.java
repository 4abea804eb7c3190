package uk.gegc.educore.features.grading.domain.model;

/**
 * Per-attempt breakdown: questions graded locally, questions sent to the text grader, and
 * questions left for a human.
 */
public record GradingSummary(int objectiveCount, int llmCount, int reviewCount) {
}
