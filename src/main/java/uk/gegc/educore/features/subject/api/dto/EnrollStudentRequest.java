package uk.gegc.educore.features.subject.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record EnrollStudentRequest(
        @Schema(description = "Student user id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "studentId is required")
        UUID studentId,

        @Schema(description = "Assign future lessons and exams automatically; defaults to true for new enrollments")
        Boolean autoAssignFuture
) {
}
