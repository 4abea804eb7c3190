package uk.gegc.educore.features.exam.api.dto;

import uk.gegc.educore.features.exam.domain.model.ExamSettings;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;

public record NormalizedPreview(String title, String subject, ExamSettings settings, int questionCount) {

    public static NormalizedPreview from(NormalizedExam exam) {
        return new NormalizedPreview(exam.title(), exam.subject(), exam.settings(), exam.questions().size());
    }
}
