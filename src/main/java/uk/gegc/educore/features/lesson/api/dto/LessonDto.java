package uk.gegc.educore.features.lesson.api.dto;

import uk.gegc.educore.features.lesson.domain.model.Lesson;

import java.time.Instant;
import java.util.UUID;

public record LessonDto(
        UUID id,
        UUID subjectId,
        String title,
        String gradeLevel,
        String contentPath,
        UUID uploadedById,
        Instant createdAt
) {

    public static LessonDto from(Lesson lesson) {
        return new LessonDto(
                lesson.getId(),
                lesson.getSubjectId(),
                lesson.getTitle(),
                lesson.getGradeLevel(),
                lesson.getContentPath(),
                lesson.getUploadedById(),
                lesson.getCreatedAt()
        );
    }
}
