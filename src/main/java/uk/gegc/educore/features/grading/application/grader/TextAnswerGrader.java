package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.application.TextAnswerGradingClient;
import uk.gegc.educore.features.grading.config.GradingProperties;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;
import uk.gegc.educore.features.grading.domain.model.TextGrade;
import uk.gegc.educore.features.grading.domain.model.TextGradingRequest;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sends short and long answers to the external grader. Any failure there is turned into a
 * zero score flagged for manual review; it never reaches the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextAnswerGrader extends QuestionGrader {

    public static final String NO_ANSWER_FEEDBACK = "No answer submitted";
    public static final String UNAVAILABLE_FEEDBACK = "grading unavailable; marked for manual review";

    private final TextAnswerGradingClient gradingClient;
    private final GradingProperties gradingProperties;

    @Override
    public Set<QuestionType> supportedTypes() {
        return EnumSet.of(QuestionType.SHORT_ANSWER, QuestionType.LONG_ANSWER);
    }

    @Override
    protected GradedQuestion doGrade(NormalizedQuestion question, JsonNode answer) {
        if (answer == null || !answer.isTextual() || answer.asText().isBlank()) {
            return GradedQuestion.forReview(question.id(), NO_ANSWER_FEEDBACK);
        }
        if (!gradingProperties.isAiEnabled()) {
            return GradedQuestion.forReview(question.id(), UNAVAILABLE_FEEDBACK);
        }

        try {
            TextGrade grade = gradingClient.gradeTextAnswer(
                    new TextGradingRequest(question.prompt(), question.rubric(), answer.asText()));
            int score = Math.max(0, Math.min(100, grade.scorePercent()));
            return new GradedQuestion(question.id(), score, grade.feedback(), false);
        } catch (RuntimeException e) {
            log.warn("Text grading failed for question {}; marking for manual review: {}",
                    question.id(), e.getMessage());
            return GradedQuestion.forReview(question.id(), UNAVAILABLE_FEEDBACK);
        }
    }
}
