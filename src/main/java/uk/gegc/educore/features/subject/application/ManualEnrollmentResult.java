package uk.gegc.educore.features.subject.application;

import java.util.UUID;

/**
 * @param enrollmentId the student's enrollment in the subject, new or existing
 * @param created      true when the enrollment did not exist before and was just inserted
 */
public record ManualEnrollmentResult(UUID enrollmentId, boolean created) {
}
