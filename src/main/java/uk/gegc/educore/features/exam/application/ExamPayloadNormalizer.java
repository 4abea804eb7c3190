package uk.gegc.educore.features.exam.application;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.domain.model.ExamSettings;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.model.QuestionType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an uploaded exam document into a {@link NormalizedExam}.
 * <p>
 * Every question is validated on its own and all problems are collected, but a single
 * error anywhere rejects the whole exam. The normalizer has no state and touches no
 * collaborators, so the same input always produces the same result.
 */
@Component
public class ExamPayloadNormalizer {

    static final String MALFORMED_PAYLOAD = "Malformed exam payload";
    static final String MISSING_TITLE_OR_QUESTIONS = "missing title or question set";
    static final String DEFAULT_SUBJECT = "General";
    static final Integer DEFAULT_POINTS = 1;

    private static final Pattern NON_SLUG_RUN = Pattern.compile("[^a-z0-9-]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    public NormalizationResult normalize(JsonNode payload) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (payload == null || !payload.isObject()) {
            errors.add(MALFORMED_PAYLOAD);
            return new NormalizationResult(null, errors, warnings);
        }

        JsonNode metadata = payload.path("examMetadata").isObject() ? payload.get("examMetadata") : payload;
        String title = firstText(metadata.get("title"), payload.get("title")).orElse("");
        String subject = firstText(metadata.get("subject"), payload.get("subject"))
                .filter(value -> !value.isEmpty())
                .orElse(DEFAULT_SUBJECT);

        JsonNode rawQuestions = payload.get("questions");
        boolean hasQuestions = rawQuestions != null && rawQuestions.isArray() && !rawQuestions.isEmpty();
        if (title.isEmpty() || !hasQuestions) {
            errors.add(MISSING_TITLE_OR_QUESTIONS);
        }

        ExamSettings settings = readSettings(payload.get("settings"));

        List<NormalizedQuestion> questions = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        if (hasQuestions) {
            for (int i = 0; i < rawQuestions.size(); i++) {
                int index = i + 1;
                JsonNode raw = rawQuestions.get(i);
                if (raw == null || !raw.isObject()) {
                    errors.add("Malformed question entry at index " + index);
                    continue;
                }
                normalizeQuestion(raw, index, seenIds, errors, warnings).ifPresent(questions::add);
            }
        }

        if (!errors.isEmpty()) {
            return new NormalizationResult(null, errors, warnings);
        }
        return new NormalizationResult(new NormalizedExam(title, subject, settings, questions), errors, warnings);
    }

    private Optional<NormalizedQuestion> normalizeQuestion(JsonNode raw, int index, Set<String> seenIds,
                                                           List<String> errors, List<String> warnings) {
        Optional<QuestionType> resolvedType = raw.path("type").isTextual()
                ? QuestionType.fromAlias(raw.get("type").asText())
                : Optional.empty();
        if (resolvedType.isEmpty()) {
            errors.add("Unsupported question type at index " + index);
            return Optional.empty();
        }
        QuestionType type = resolvedType.get();

        JsonNode promptNode = raw.hasNonNull("prompt") ? raw.get("prompt") : raw.get("questionText");
        if (promptNode == null || !promptNode.isTextual() || promptNode.asText().isBlank()) {
            errors.add("Missing prompt at question index " + index);
            return Optional.empty();
        }

        String fallbackId = "q" + index;
        String sourceId = raw.path("id").isTextual() ? raw.get("id").asText() : fallbackId;
        String questionId = slugSafeId(sourceId, fallbackId);
        if (seenIds.contains(questionId)) {
            questionId = fallbackId;
        }
        if (seenIds.contains(questionId)) {
            errors.add("Duplicate question id after normalization: " + questionId);
            return Optional.empty();
        }
        seenIds.add(questionId);

        Number points = positiveOr(raw.get("points"), DEFAULT_POINTS);

        List<String> choices = null;
        Object correctAnswer = null;
        String rubric = null;

        switch (type) {
            case MULTIPLE_CHOICE -> {
                JsonNode choicesNode = raw.path("options").isArray() ? raw.get("options") : raw.get("choices");
                Optional<List<String>> parsed = stringArray(choicesNode);
                if (parsed.isEmpty() || parsed.get().isEmpty()) {
                    errors.add("Malformed answer schema for " + questionId);
                    return Optional.empty();
                }
                choices = parsed.get();
                JsonNode answerNode = raw.get("correctAnswer");
                if (answerNode != null && answerNode.isTextual()) {
                    correctAnswer = answerNode.asText();
                    if (!choices.contains(answerNode.asText())) {
                        warnings.add("correctAnswer for " + questionId + " is not one of its choices");
                    }
                } else if (answerNode != null && !answerNode.isNull()) {
                    warnings.add("correctAnswer for " + questionId + " is not a string and was ignored");
                }
            }
            case TRUE_FALSE -> correctAnswer = coerceBoolean(raw.get("correctAnswer"));
            case SHORT_ANSWER, LONG_ANSWER -> {
                JsonNode rubricNode = raw.get("rubric");
                if (rubricNode != null && rubricNode.isTextual() && !rubricNode.asText().isBlank()) {
                    rubric = rubricNode.asText();
                }
            }
        }

        return Optional.of(new NormalizedQuestion(
                questionId, type, promptNode.asText().trim(), choices, correctAnswer, rubric, points));
    }

    static String slugSafeId(String candidate, String fallbackId) {
        String lowered = candidate.toLowerCase(Locale.ROOT).trim();
        String slug = EDGE_DASHES.matcher(NON_SLUG_RUN.matcher(lowered).replaceAll("-")).replaceAll("");
        return slug.isEmpty() ? fallbackId : slug;
    }

    /**
     * Accepts a JSON boolean or the literal strings {@code "true"} and {@code "false"}.
     */
    public static Boolean coerceBoolean(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            if ("true".equals(node.asText())) {
                return Boolean.TRUE;
            }
            if ("false".equals(node.asText())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private static ExamSettings readSettings(JsonNode settings) {
        if (settings == null || !settings.isObject()) {
            return ExamSettings.defaults();
        }
        return new ExamSettings(
                positiveOr(settings.get("timeLimitMinutes"), ExamSettings.DEFAULT_TIME_LIMIT_MINUTES),
                positiveOr(settings.get("passingScorePercent"), ExamSettings.DEFAULT_PASSING_SCORE_PERCENT)
        );
    }

    private static Number positiveOr(JsonNode node, Number fallback) {
        return node != null && node.isNumber() && node.asDouble() > 0 ? node.numberValue() : fallback;
    }

    private static Optional<String> firstText(JsonNode preferred, JsonNode fallback) {
        if (preferred != null && preferred.isTextual()) {
            return Optional.of(preferred.asText().trim());
        }
        if (fallback != null && fallback.isTextual()) {
            return Optional.of(fallback.asText().trim());
        }
        return Optional.empty();
    }

    private static Optional<List<String>> stringArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            return Optional.empty();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return Optional.empty();
            }
            values.add(item.asText());
        }
        return Optional.of(values);
    }
}
