package uk.gegc.educore.features.assignment.api.dto;

import uk.gegc.educore.features.assignment.domain.model.AssignmentSource;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;
import uk.gegc.educore.features.subject.domain.model.EnrollmentStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A student's view of one assignment, with the content title and how many attempts are used.
 */
public record MyAssignmentDto(
        UUID id,
        UUID assignedByTeacherId,
        UUID lessonId,
        UUID examId,
        String title,
        UUID subjectId,
        String subjectName,
        AssignmentType assignmentType,
        AssignmentSource assignmentSource,
        int maxAttempts,
        long attemptsUsed,
        EnrollmentStatus subjectEnrollmentStatus,
        Instant dueAt,
        Instant createdAt
) {
}
