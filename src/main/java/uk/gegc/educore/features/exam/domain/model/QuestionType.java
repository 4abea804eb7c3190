package uk.gegc.educore.features.exam.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum QuestionType {
    MULTIPLE_CHOICE("multiple-choice", true),
    TRUE_FALSE("true-false", true),
    SHORT_ANSWER("short-answer", false),
    LONG_ANSWER("long-answer", false);

    private static final Map<String, QuestionType> ALIASES = Map.ofEntries(
            Map.entry("mcq", MULTIPLE_CHOICE),
            Map.entry("multiple-choice", MULTIPLE_CHOICE),
            Map.entry("multiple_choice", MULTIPLE_CHOICE),
            Map.entry("tf", TRUE_FALSE),
            Map.entry("true-false", TRUE_FALSE),
            Map.entry("true_false", TRUE_FALSE),
            Map.entry("short", SHORT_ANSWER),
            Map.entry("short-answer", SHORT_ANSWER),
            Map.entry("short_answer", SHORT_ANSWER),
            Map.entry("long", LONG_ANSWER),
            Map.entry("long-answer", LONG_ANSWER),
            Map.entry("long_answer", LONG_ANSWER)
    );

    private final String wireName;
    private final boolean objective;

    QuestionType(String wireName, boolean objective) {
        this.wireName = wireName;
        this.objective = objective;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Multiple-choice and true-false questions are graded locally; the rest go to the text grader.
     */
    public boolean isObjective() {
        return objective;
    }

    /**
     * Resolves an uploaded type label, including legacy spellings such as {@code mcq} or {@code true_false}.
     */
    public static Optional<QuestionType> fromAlias(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    public static QuestionType fromWireName(String value) {
        return fromAlias(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + value));
    }
}
