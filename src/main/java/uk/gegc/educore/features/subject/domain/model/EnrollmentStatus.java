package uk.gegc.educore.features.subject.domain.model;

public enum EnrollmentStatus {
    ACTIVE,
    COMPLETED
}
