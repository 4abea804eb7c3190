package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;

import java.util.EnumSet;
import java.util.Set;

@Component
public class MultipleChoiceGrader extends QuestionGrader {

    @Override
    public Set<QuestionType> supportedTypes() {
        return EnumSet.of(QuestionType.MULTIPLE_CHOICE);
    }

    @Override
    protected GradedQuestion doGrade(NormalizedQuestion question, JsonNode answer) {
        String expected = question.correctChoice();
        boolean correct = expected != null
                && answer != null
                && answer.isTextual()
                && expected.equals(answer.asText());
        return correct ? GradedQuestion.correct(question.id()) : GradedQuestion.incorrect(question.id());
    }
}
