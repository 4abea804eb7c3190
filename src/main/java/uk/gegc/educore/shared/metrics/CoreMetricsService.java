package uk.gegc.educore.shared.metrics;

import java.time.Duration;

/**
 * Observability sink for the content, assignment and grading flows.
 */
public interface CoreMetricsService {

    void recordAutoAssign(int created, int skipped);

    void incrementEnrollmentCreated();

    void incrementEnrollmentReactivated();

    void incrementEnrollmentCompleted();

    void incrementExamUpload(boolean accepted);

    void incrementAttemptSubmitted(String outcome);

    void recordExternalGrade(Duration latency, boolean success);
}
