package uk.gegc.educore.features.grading.application.grader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("Objective graders")
class ObjectiveGradersTest {

    private final MultipleChoiceGrader multipleChoiceGrader = new MultipleChoiceGrader();
    private final TrueFalseGrader trueFalseGrader = new TrueFalseGrader();

    private static NormalizedQuestion mcq(String correct) {
        return new NormalizedQuestion("m1", QuestionType.MULTIPLE_CHOICE, "Pick one", List.of("a", "b"), correct, null, 1);
    }

    private static NormalizedQuestion tf(Boolean correct) {
        return new NormalizedQuestion("t1", QuestionType.TRUE_FALSE, "Sky is blue", null, correct, null, 1);
    }

    @Test
    @DisplayName("multiple choice is correct only on an exact string match")
    void multipleChoiceExactMatch() {
        assertThat(multipleChoiceGrader.grade(mcq("b"), TextNode.valueOf("b")))
                .isEqualTo(new GradedQuestion("m1", 100, "Correct", false));
        assertThat(multipleChoiceGrader.grade(mcq("b"), TextNode.valueOf("B")).scorePercent()).isZero();
        assertThat(multipleChoiceGrader.grade(mcq("b"), TextNode.valueOf(" b")).feedback()).isEqualTo("Incorrect");
    }

    @Test
    @DisplayName("multiple choice without an answer key or a textual answer scores zero")
    void multipleChoiceUngradable() {
        assertThat(multipleChoiceGrader.grade(mcq(null), TextNode.valueOf("a")).scorePercent()).isZero();
        assertThat(multipleChoiceGrader.grade(mcq("a"), IntNode.valueOf(0)).scorePercent()).isZero();
        assertThat(multipleChoiceGrader.grade(mcq("a"), null).needsReview()).isFalse();
        assertThat(multipleChoiceGrader.grade(mcq("a"), MissingNode.getInstance()).scorePercent()).isZero();
    }

    @Test
    @DisplayName("true-false accepts booleans and the literal strings")
    void trueFalseCoercion() {
        assertThat(trueFalseGrader.grade(tf(true), BooleanNode.TRUE).scorePercent()).isEqualTo(100);
        assertThat(trueFalseGrader.grade(tf(false), TextNode.valueOf("false")).scorePercent()).isEqualTo(100);
        assertThat(trueFalseGrader.grade(tf(true), TextNode.valueOf("TRUE")).scorePercent()).isZero();
        assertThat(trueFalseGrader.grade(tf(true), BooleanNode.FALSE).feedback()).isEqualTo("Incorrect");
    }

    @Test
    @DisplayName("true-false without an answer key never scores")
    void trueFalseWithoutKey() {
        JsonNode answer = BooleanNode.TRUE;

        assertThat(trueFalseGrader.grade(tf(null), answer).scorePercent()).isZero();
    }

    @Test
    @DisplayName("factory routes each type to its grader and rejects unknown types")
    void factoryRouting() {
        GraderFactory factory = new GraderFactory(List.of(multipleChoiceGrader, trueFalseGrader));

        assertThat(factory.getGrader(QuestionType.MULTIPLE_CHOICE)).isSameAs(multipleChoiceGrader);
        assertThat(factory.getGrader(QuestionType.TRUE_FALSE)).isSameAs(trueFalseGrader);
        assertThatThrownBy(() -> factory.getGrader(QuestionType.LONG_ANSWER))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
