package uk.gegc.educore.features.subject.api.dto;

import jakarta.validation.constraints.Size;

public record UpdateSubjectRequest(
        @Size(max = 120, message = "Subject name must be at most 120 characters")
        String name,
        Boolean archived
) {
}
