package uk.gegc.educore.features.grading.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for grading submitted attempts.
 */
@Component
@ConfigurationProperties(prefix = "educore.grading")
@Data
public class GradingProperties {

    /**
     * When false, free-text answers are never sent out and go straight to manual review.
     */
    private boolean aiEnabled = true;

    /**
     * Upper bound on concurrent text-grader calls per submission. 1 grades one question at a time.
     */
    private int maxConcurrentCalls = 1;
}
