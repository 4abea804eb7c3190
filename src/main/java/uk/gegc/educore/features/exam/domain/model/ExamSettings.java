package uk.gegc.educore.features.exam.domain.model;

/**
 * Exam-level settings. Values keep the numeric form they were uploaded with.
 */
public record ExamSettings(Number timeLimitMinutes, Number passingScorePercent) {

    public static final Integer DEFAULT_TIME_LIMIT_MINUTES = 30;
    public static final Integer DEFAULT_PASSING_SCORE_PERCENT = 70;

    public static ExamSettings defaults() {
        return new ExamSettings(DEFAULT_TIME_LIMIT_MINUTES, DEFAULT_PASSING_SCORE_PERCENT);
    }
}
