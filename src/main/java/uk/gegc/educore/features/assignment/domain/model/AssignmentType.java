package uk.gegc.educore.features.assignment.domain.model;

public enum AssignmentType {
    PRACTICE,
    ASSESSMENT;

    /**
     * Attempts allowed when the assigner does not say: one for assessments, three for practice.
     */
    public int defaultMaxAttempts() {
        return this == ASSESSMENT ? 1 : 3;
    }
}
