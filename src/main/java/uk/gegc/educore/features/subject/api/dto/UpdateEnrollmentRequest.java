package uk.gegc.educore.features.subject.api.dto;

import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;

public record UpdateEnrollmentRequest(EnrollmentStatus status, Boolean autoAssignFuture) {
}
