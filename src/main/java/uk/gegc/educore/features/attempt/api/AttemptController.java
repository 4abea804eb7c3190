package uk.gegc.educore.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
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
import uk.gegc.educore.features.attempt.api.dto.*;
import uk.gegc.educore.features.attempt.application.AttemptService;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.UUID;

@Tag(name = "Attempts", description = "Exam attempts: start, autosave, submit and results")
@RestController
@RequestMapping("/api/v1/attempts")
@RequiredArgsConstructor
@Validated
public class AttemptController {

    private final AttemptService attemptService;

    @Operation(summary = "Start an attempt for an exam assignment")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt started",
                    content = @Content(schema = @Schema(implementation = AttemptDto.class))),
            @ApiResponse(responseCode = "403", description = "Assignment is not the caller's",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "An attempt is in progress or no attempts are left",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class),
                            examples = @ExampleObject(name = "quota", value = """
                                    {
                                      "type": "https://educore.gegc.uk/docs/errors/illegal-state",
                                      "title": "Conflict",
                                      "status": 409,
                                      "detail": "Maximum attempts reached for this assignment"
                                    }
                                    """)))
    })
    @PostMapping
    public ResponseEntity<AttemptDto> createAttempt(
            @RequestBody @Valid CreateAttemptRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(attemptService.createAttempt(caller, request.assignmentId()));
    }

    @Operation(summary = "Autosave answers", description = "Upserts answers by question id while the attempt is in progress.")
    @PatchMapping("/{attemptId}/responses")
    public ResponseEntity<SaveResponsesResponse> saveResponses(
            @Parameter(description = "Attempt UUID", required = true) @PathVariable UUID attemptId,
            @RequestBody @Valid SaveResponsesRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(attemptService.saveResponses(caller, attemptId, request));
    }

    @Operation(summary = "Submit an attempt for grading")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt graded",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "409", description = "Attempt already submitted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{attemptId}/submit")
    public ResponseEntity<SubmissionDto> submitAttempt(
            @Parameter(description = "Attempt UUID", required = true) @PathVariable UUID attemptId,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(attemptService.submitAttempt(caller, attemptId));
    }

    @Operation(summary = "Get an attempt with per-question grading")
    @GetMapping("/{attemptId}/result")
    public ResponseEntity<AttemptResultDto> getAttemptResult(
            @Parameter(description = "Attempt UUID", required = true) @PathVariable UUID attemptId,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(attemptService.getAttemptResult(caller, attemptId));
    }
}
