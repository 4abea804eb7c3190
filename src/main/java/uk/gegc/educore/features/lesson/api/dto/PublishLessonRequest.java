package uk.gegc.educore.features.lesson.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "PublishLessonRequest", description = "Lesson metadata; the content itself is stored elsewhere")
public record PublishLessonRequest(
        @Schema(description = "Subject the lesson belongs to", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "subjectId is required")
        UUID subjectId,

        @Schema(description = "Lesson title", example = "Fractions 101")
        @NotBlank(message = "Title must not be blank")
        @Size(max = 200, message = "Title must be at most 200 characters")
        String title,

        @Schema(description = "Grade level label", example = "Year 7")
        @Size(max = 40)
        String gradeLevel,

        @Schema(description = "Storage path of the lesson content")
        @Size(max = 500)
        String contentPath
) {
}
