package uk.gegc.educore.features.subject.api.dto;

import uk.gegc.educore.features.subject.domain.model.Subject;

import java.time.Instant;
import java.util.UUID;

public record SubjectDto(
        UUID id,
        UUID tenantId,
        UUID teacherOwnerId,
        String name,
        String description,
        boolean archived,
        Instant createdAt
) {

    public static SubjectDto from(Subject subject) {
        return new SubjectDto(
                subject.getId(),
                subject.getTenantId(),
                subject.getTeacherOwnerId(),
                subject.getName(),
                subject.getDescription(),
                subject.isArchived(),
                subject.getCreatedAt()
        );
    }
}
