package uk.gegc.educore.features.assignment.domain.model;

public enum AssignmentSource {
    MANUAL,
    SUBJECT_AUTO
}
