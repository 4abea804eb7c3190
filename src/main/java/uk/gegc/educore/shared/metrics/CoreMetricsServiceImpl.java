package uk.gegc.educore.shared.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer-backed implementation of {@link CoreMetricsService}.
 */
@Slf4j
@Service
public class CoreMetricsServiceImpl implements CoreMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter autoAssignCreatedCounter;
    private final Counter autoAssignSkippedCounter;
    private final Counter enrollmentCreatedCounter;
    private final Counter enrollmentReactivatedCounter;
    private final Counter enrollmentCompletedCounter;
    private final Counter externalGradeCallsCounter;
    private final Counter externalGradeFailuresCounter;

    private final Timer externalGradeLatencyTimer;

    public CoreMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.autoAssignCreatedCounter = Counter.builder("subject.auto_assign.created")
                .description("Assignments inserted by auto-assignment")
                .register(meterRegistry);
        this.autoAssignSkippedCounter = Counter.builder("subject.auto_assign.skipped")
                .description("Auto-assignment candidates that already existed")
                .register(meterRegistry);
        this.enrollmentCreatedCounter = Counter.builder("subject.enrollment.created")
                .description("Subject enrollments created")
                .register(meterRegistry);
        this.enrollmentReactivatedCounter = Counter.builder("subject.enrollment.reactivated")
                .description("Completed subject enrollments moved back to active")
                .register(meterRegistry);
        this.enrollmentCompletedCounter = Counter.builder("subject.enrollment.completed")
                .description("Subject enrollments marked completed")
                .register(meterRegistry);
        this.externalGradeCallsCounter = Counter.builder("grading.external.calls")
                .description("Calls made to the external text grader")
                .register(meterRegistry);
        this.externalGradeFailuresCounter = Counter.builder("grading.external.failures")
                .description("External grader calls that failed or returned unusable output")
                .register(meterRegistry);
        this.externalGradeLatencyTimer = Timer.builder("grading.external.latency")
                .description("Latency of external grader calls")
                .register(meterRegistry);
    }

    @Override
    public void recordAutoAssign(int created, int skipped) {
        if (created > 0) {
            autoAssignCreatedCounter.increment(created);
        }
        if (skipped > 0) {
            autoAssignSkippedCounter.increment(skipped);
        }
        log.debug("Auto-assign metrics recorded: created={}, skipped={}", created, skipped);
    }

    @Override
    public void incrementEnrollmentCreated() {
        enrollmentCreatedCounter.increment();
    }

    @Override
    public void incrementEnrollmentReactivated() {
        enrollmentReactivatedCounter.increment();
    }

    @Override
    public void incrementEnrollmentCompleted() {
        enrollmentCompletedCounter.increment();
    }

    @Override
    public void incrementExamUpload(boolean accepted) {
        Counter.builder("exam.upload")
                .description("Exam uploads by validation outcome")
                .tag("outcome", accepted ? "accepted" : "rejected")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementAttemptSubmitted(String outcome) {
        Counter.builder("attempt.submitted")
                .description("Submitted attempts by grading outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordExternalGrade(Duration latency, boolean success) {
        externalGradeCallsCounter.increment();
        if (!success) {
            externalGradeFailuresCounter.increment();
        }
        if (latency != null) {
            externalGradeLatencyTimer.record(latency);
        }
    }
}
