package uk.gegc.educore.features.grading.infra.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Service;
import uk.gegc.educore.features.grading.application.TextAnswerGradingClient;
import uk.gegc.educore.features.grading.domain.model.TextGrade;
import uk.gegc.educore.features.grading.domain.model.TextGradingRequest;
import uk.gegc.educore.shared.exception.AiServiceException;
import uk.gegc.educore.shared.metrics.CoreMetricsService;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiTextAnswerGradingClient implements TextAnswerGradingClient {

    static final String SYSTEM_PROMPT =
            "You are a strict exam grader. Return JSON only: {\"scorePercent\":number,\"feedback\":string}";
    static final String DEFAULT_FEEDBACK = "Needs manual review.";

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final CoreMetricsService metricsService;

    @Override
    public TextGrade gradeTextAnswer(TextGradingRequest request) {
        Instant start = Instant.now();
        try {
            ChatResponse response = chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(buildUserMessage(request))
                    .call()
                    .chatResponse();

            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new AiServiceException("No response received from grading model");
            }

            TextGrade grade = parseGrade(response.getResult().getOutput().getText());
            metricsService.recordExternalGrade(Duration.between(start, Instant.now()), true);
            log.debug("Text answer graded with score {} in {}ms",
                    grade.scorePercent(), Duration.between(start, Instant.now()).toMillis());
            return grade;
        } catch (AiServiceException e) {
            metricsService.recordExternalGrade(Duration.between(start, Instant.now()), false);
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordExternalGrade(Duration.between(start, Instant.now()), false);
            throw new AiServiceException("Grading model call failed: " + e.getMessage(), e);
        }
    }

    static String buildUserMessage(TextGradingRequest request) {
        String rubric = request.rubric() != null ? request.rubric() : "N/A";
        return "Question: " + request.prompt() + "\nRubric: " + rubric + "\nAnswer: " + request.answer();
    }

    TextGrade parseGrade(String content) {
        if (content == null) {
            throw new AiServiceException("Grading model returned an empty response");
        }
        Matcher matcher = JSON_OBJECT.matcher(content);
        if (!matcher.find()) {
            throw new AiServiceException("Grading model returned a non-JSON response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new AiServiceException("Grading model returned malformed JSON", e);
        }

        JsonNode score = root.get("scorePercent");
        if (score == null || !score.isNumber()) {
            throw new AiServiceException("Grading model response has no numeric scorePercent");
        }
        int scorePercent = (int) Math.max(0, Math.min(100, Math.round(score.asDouble())));

        JsonNode feedbackNode = root.get("feedback");
        String feedback = feedbackNode != null && feedbackNode.isTextual() && !feedbackNode.asText().isBlank()
                ? feedbackNode.asText()
                : DEFAULT_FEEDBACK;
        return new TextGrade(scorePercent, feedback);
    }
}
