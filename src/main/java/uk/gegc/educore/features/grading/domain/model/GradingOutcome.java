package uk.gegc.educore.features.grading.domain.model;

import java.util.List;

public record GradingOutcome(int scorePercent, List<GradedQuestion> perQuestion, GradingSummary summary) {

    public GradingOutcome {
        perQuestion = List.copyOf(perQuestion);
    }

    public boolean needsReview() {
        return summary.reviewCount() > 0;
    }
}
