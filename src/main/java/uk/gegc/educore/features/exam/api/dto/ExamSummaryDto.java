package uk.gegc.educore.features.exam.api.dto;

import uk.gegc.educore.features.exam.domain.model.Exam;

import java.time.Instant;
import java.util.UUID;

public record ExamSummaryDto(
        UUID id,
        UUID subjectId,
        String title,
        String subjectName,
        UUID uploadedById,
        Instant createdAt
) {

    public static ExamSummaryDto from(Exam exam) {
        return new ExamSummaryDto(
                exam.getId(),
                exam.getSubjectId(),
                exam.getTitle(),
                exam.getSubjectName(),
                exam.getUploadedById(),
                exam.getCreatedAt()
        );
    }
}
