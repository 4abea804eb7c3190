package uk.gegc.educore.features.attempt.domain.model;

/**
 * {@code IN_PROGRESS -> SUBMITTED -> GRADED | NEEDS_REVIEW}. No state is entered twice.
 */
public enum AttemptStatus {
    IN_PROGRESS,
    SUBMITTED,
    GRADED,
    NEEDS_REVIEW;

    public boolean isTerminal() {
        return this == GRADED || this == NEEDS_REVIEW;
    }
}
