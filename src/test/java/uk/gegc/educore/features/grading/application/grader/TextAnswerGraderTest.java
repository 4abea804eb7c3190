package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.application.TextAnswerGradingClient;
import uk.gegc.educore.features.grading.config.GradingProperties;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;
import uk.gegc.educore.features.grading.domain.model.TextGrade;
import uk.gegc.educore.features.grading.domain.model.TextGradingRequest;
import uk.gegc.educore.shared.exception.AiServiceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TextAnswerGrader")
class TextAnswerGraderTest {

    @Mock
    private TextAnswerGradingClient gradingClient;

    private GradingProperties gradingProperties;
    private TextAnswerGrader grader;

    private final NormalizedQuestion question = new NormalizedQuestion(
            "s1", QuestionType.SHORT_ANSWER, "What is photosynthesis?", null, null, "Mentions light", 1);

    @BeforeEach
    void setUp() {
        gradingProperties = new GradingProperties();
        grader = new TextAnswerGrader(gradingClient, gradingProperties);
    }

    @Test
    @DisplayName("blank or non-text answers go to review without calling the grader")
    void noAnswer() {
        GradedQuestion blank = grader.grade(question, TextNode.valueOf("   "));
        GradedQuestion number = grader.grade(question, IntNode.valueOf(3));
        GradedQuestion missing = grader.grade(question, null);

        assertThat(blank).isEqualTo(new GradedQuestion("s1", 0, TextAnswerGrader.NO_ANSWER_FEEDBACK, true));
        assertThat(number.needsReview()).isTrue();
        assertThat(missing.feedback()).isEqualTo(TextAnswerGrader.NO_ANSWER_FEEDBACK);
        verifyNoInteractions(gradingClient);
    }

    @Test
    @DisplayName("successful grading passes prompt, rubric and answer and clamps the score")
    void success() {
        when(gradingClient.gradeTextAnswer(any())).thenReturn(new TextGrade(140, "Excellent"));

        GradedQuestion result = grader.grade(question, TextNode.valueOf("Plants use light"));

        ArgumentCaptor<TextGradingRequest> captor = ArgumentCaptor.forClass(TextGradingRequest.class);
        verify(gradingClient).gradeTextAnswer(captor.capture());
        assertThat(captor.getValue()).isEqualTo(
                new TextGradingRequest("What is photosynthesis?", "Mentions light", "Plants use light"));
        assertThat(result).isEqualTo(new GradedQuestion("s1", 100, "Excellent", false));
    }

    @Test
    @DisplayName("grader failure becomes zero with review, never an exception")
    void failure() {
        when(gradingClient.gradeTextAnswer(any())).thenThrow(new AiServiceException("timeout"));

        GradedQuestion result = grader.grade(question, TextNode.valueOf("Plants use light"));

        assertThat(result).isEqualTo(new GradedQuestion("s1", 0, TextAnswerGrader.UNAVAILABLE_FEEDBACK, true));
    }

    @Test
    @DisplayName("disabled external grading sends answers straight to review")
    void disabled() {
        gradingProperties.setAiEnabled(false);

        GradedQuestion result = grader.grade(question, TextNode.valueOf("Plants use light"));

        assertThat(result.needsReview()).isTrue();
        assertThat(result.feedback()).isEqualTo(TextAnswerGrader.UNAVAILABLE_FEEDBACK);
        verifyNoInteractions(gradingClient);
    }
}
