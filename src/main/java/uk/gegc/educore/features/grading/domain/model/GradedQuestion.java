package uk.gegc.educore.features.grading.domain.model;

public record GradedQuestion(String questionId, int scorePercent, String feedback, boolean needsReview) {

    public static GradedQuestion correct(String questionId) {
        return new GradedQuestion(questionId, 100, "Correct", false);
    }

    public static GradedQuestion incorrect(String questionId) {
        return new GradedQuestion(questionId, 0, "Incorrect", false);
    }

    public static GradedQuestion forReview(String questionId, String feedback) {
        return new GradedQuestion(questionId, 0, feedback, true);
    }
}
