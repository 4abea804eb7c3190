package uk.gegc.educore.features.subject.api.dto;

import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;
import uk.gegc.educore.features.subject.domain.model.SubjectEnrollment;

import java.time.Instant;
import java.util.UUID;

public record SubjectEnrollmentDto(
        UUID id,
        UUID subjectId,
        UUID studentId,
        EnrollmentStatus status,
        boolean autoAssignFuture,
        Instant completedAt,
        Instant createdAt
) {

    public static SubjectEnrollmentDto from(SubjectEnrollment enrollment) {
        return new SubjectEnrollmentDto(
                enrollment.getId(),
                enrollment.getSubjectId(),
                enrollment.getStudentId(),
                enrollment.getStatus(),
                enrollment.isAutoAssignFuture(),
                enrollment.getCompletedAt(),
                enrollment.getCreatedAt()
        );
    }
}
