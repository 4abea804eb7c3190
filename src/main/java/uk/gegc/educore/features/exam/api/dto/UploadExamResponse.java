package uk.gegc.educore.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "UploadExamResponse",
        description = "Result of an exam upload; invalid payloads are reported here rather than as an error response")
public record UploadExamResponse(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        UUID examId,
        int assignmentsCreated,
        NormalizedPreview normalizedPreview
) {

    public static UploadExamResponse rejected(List<String> errors, List<String> warnings) {
        return new UploadExamResponse(false, errors, warnings, null, 0, null);
    }
}
