package uk.gegc.educore.features.lesson.application;

import uk.gegc.educore.features.lesson.api.dto.LessonDto;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonRequest;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonResponse;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

public interface LessonService {

    /**
     * Stores the lesson and assigns it to every active enrollment of its subject
     * that has auto-assignment on.
     */
    PublishLessonResponse publishLesson(CallerContext caller, PublishLessonRequest request);

    List<LessonDto> listLessons(CallerContext caller, UUID subjectId);

    LessonDto getLesson(CallerContext caller, UUID lessonId);

    void deleteLesson(CallerContext caller, UUID lessonId);
}
