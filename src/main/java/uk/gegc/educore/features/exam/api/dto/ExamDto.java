package uk.gegc.educore.features.exam.api.dto;

import uk.gegc.educore.features.exam.domain.model.ExamSettings;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Full exam view. Students get questions without correct answers or rubrics.
 */
public record ExamDto(
        UUID id,
        UUID subjectId,
        String title,
        String subjectName,
        ExamSettings settings,
        List<NormalizedQuestion> questions,
        Instant createdAt
) {
}
