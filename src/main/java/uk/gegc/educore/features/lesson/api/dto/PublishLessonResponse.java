package uk.gegc.educore.features.lesson.api.dto;

public record PublishLessonResponse(LessonDto lesson, int assignmentsCreated) {
}
