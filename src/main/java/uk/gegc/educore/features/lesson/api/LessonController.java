package uk.gegc.educore.features.lesson.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.educore.features.lesson.api.dto.LessonDto;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonRequest;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonResponse;
import uk.gegc.educore.features.lesson.application.LessonService;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

@Tag(name = "Lessons", description = "Lesson publication within subjects")
@RestController
@RequestMapping("/api/v1/lessons")
@RequiredArgsConstructor
@Validated
public class LessonController {

    private final LessonService lessonService;

    @Operation(summary = "Publish a lesson",
            description = "Stores the lesson and assigns it to students enrolled with auto-assignment on.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Lesson published",
                    content = @Content(schema = @Schema(implementation = PublishLessonResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or archived subject",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<PublishLessonResponse> publishLesson(
            @RequestBody @Valid PublishLessonRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lessonService.publishLesson(caller, request));
    }

    @Operation(summary = "List lessons of a subject")
    @GetMapping
    public ResponseEntity<List<LessonDto>> listLessons(
            @Parameter(description = "Subject UUID", required = true)
            @RequestParam(name = "subjectId") UUID subjectId,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(lessonService.listLessons(caller, subjectId));
    }

    @Operation(summary = "Get a lesson")
    @GetMapping("/{lessonId}")
    public ResponseEntity<LessonDto> getLesson(@PathVariable UUID lessonId,
                                               @AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(lessonService.getLesson(caller, lessonId));
    }

    @Operation(summary = "Delete a lesson", description = "Soft delete; existing assignments are kept.")
    @DeleteMapping("/{lessonId}")
    public ResponseEntity<Void> deleteLesson(@PathVariable UUID lessonId,
                                             @AuthenticationPrincipal CallerContext caller) {
        lessonService.deleteLesson(caller, lessonId);
        return ResponseEntity.noContent().build();
    }
}
