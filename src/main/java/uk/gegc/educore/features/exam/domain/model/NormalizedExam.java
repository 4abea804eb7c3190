package uk.gegc.educore.features.exam.domain.model;

import java.util.List;

public record NormalizedExam(String title, String subject, ExamSettings settings, List<NormalizedQuestion> questions) {

    public NormalizedExam {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public boolean hasQuestion(String questionId) {
        return questions.stream().anyMatch(question -> question.id().equals(questionId));
    }
}
