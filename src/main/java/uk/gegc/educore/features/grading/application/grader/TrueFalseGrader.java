package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.application.ExamPayloadNormalizer;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;

import java.util.EnumSet;
import java.util.Set;

@Component
public class TrueFalseGrader extends QuestionGrader {

    @Override
    public Set<QuestionType> supportedTypes() {
        return EnumSet.of(QuestionType.TRUE_FALSE);
    }

    @Override
    protected GradedQuestion doGrade(NormalizedQuestion question, JsonNode answer) {
        Boolean submitted = ExamPayloadNormalizer.coerceBoolean(answer);
        boolean correct = submitted != null && submitted.equals(question.correctBoolean());
        return correct ? GradedQuestion.correct(question.id()) : GradedQuestion.incorrect(question.id());
    }
}
