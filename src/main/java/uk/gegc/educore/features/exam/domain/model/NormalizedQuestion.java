package uk.gegc.educore.features.exam.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One question in canonical form.
 * <p>
 * {@code correctAnswer} holds a {@link String} for multiple-choice questions and a
 * {@link Boolean} for true-false questions; it is {@code null} when the question cannot
 * be graded objectively. {@code points} keeps the numeric form it was given in, so
 * whole numbers stay integral in the stored document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedQuestion(
        String id,
        QuestionType type,
        String prompt,
        List<String> choices,
        Object correctAnswer,
        String rubric,
        Number points
) {

    public NormalizedQuestion {
        choices = choices == null ? null : List.copyOf(choices);
    }

    @JsonIgnore
    public String correctChoice() {
        return correctAnswer instanceof String value ? value : null;
    }

    @JsonIgnore
    public Boolean correctBoolean() {
        return correctAnswer instanceof Boolean value ? value : null;
    }

    /**
     * Copy safe to show a student taking the exam.
     */
    public NormalizedQuestion withoutAnswerKey() {
        return new NormalizedQuestion(id, type, prompt, choices, null, null, points);
    }
}
