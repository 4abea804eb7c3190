package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;

import java.util.Set;

public abstract class QuestionGrader {

    /**
     * Returns the question types this grader handles
     * @return the supported question types
     */
    public abstract Set<QuestionType> supportedTypes();

    /**
     * Grades one answer. Implementations never throw for bad answers; a missing or
     * unusable answer is graded like any other.
     *
     * @param answer the submitted JSON answer, or {@code null} when nothing was saved
     */
    public GradedQuestion grade(NormalizedQuestion question, JsonNode answer) {
        JsonNode value = answer == null || answer.isMissingNode() ? null : answer;
        return doGrade(question, value);
    }

    protected abstract GradedQuestion doGrade(NormalizedQuestion question, JsonNode answer);
}
