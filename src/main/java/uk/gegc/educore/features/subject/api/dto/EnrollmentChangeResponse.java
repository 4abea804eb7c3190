package uk.gegc.educore.features.subject.api.dto;

/**
 * Enrollment after the change, with the number of assignments the change created.
 */
public record EnrollmentChangeResponse(SubjectEnrollmentDto enrollment, int lessonsCreated, int examsCreated) {
}
