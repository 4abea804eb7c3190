package uk.gegc.educore.features.assignment.api.dto;

import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.model.AssignmentSource;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;

import java.time.Instant;
import java.util.UUID;

public record AssignmentDto(
        UUID id,
        UUID assigneeStudentId,
        UUID assignedByTeacherId,
        UUID lessonId,
        UUID examId,
        AssignmentSource assignmentSource,
        UUID subjectEnrollmentId,
        AssignmentType assignmentType,
        int maxAttempts,
        Instant dueAt,
        Instant createdAt
) {

    public static AssignmentDto from(Assignment assignment) {
        return new AssignmentDto(
                assignment.getId(),
                assignment.getAssigneeStudentId(),
                assignment.getAssignedByTeacherId(),
                assignment.getLessonId(),
                assignment.getExamId(),
                assignment.getAssignmentSource(),
                assignment.getSubjectEnrollmentId(),
                assignment.getAssignmentType(),
                assignment.getMaxAttempts(),
                assignment.getDueAt(),
                assignment.getCreatedAt()
        );
    }
}
