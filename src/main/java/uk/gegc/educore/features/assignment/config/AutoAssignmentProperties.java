package uk.gegc.educore.features.assignment.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.assignment.domain.model.AssignmentType;

/**
 * Shape of assignments created automatically for subject enrollments.
 */
@Component
@ConfigurationProperties(prefix = "educore.assignments.auto")
@Data
public class AutoAssignmentProperties {

    private AssignmentType assignmentType = AssignmentType.PRACTICE;

    private int maxAttempts = 3;
}
