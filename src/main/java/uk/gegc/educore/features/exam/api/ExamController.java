package uk.gegc.educore.features.exam.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.educore.features.exam.api.dto.ExamDto;
import uk.gegc.educore.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.educore.features.exam.api.dto.UploadExamResponse;
import uk.gegc.educore.features.exam.application.ExamService;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

@Tag(name = "Exams", description = "Exam upload, normalization and retrieval")
@RestController
@RequestMapping("/api/v1/exams")
@RequiredArgsConstructor
@Validated
public class ExamController {

    private final ExamService examService;

    @Operation(
            summary = "Upload an exam",
            description = "Normalizes the exam document. Invalid documents come back with valid=false and the collected errors."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Upload processed",
                    content = @Content(schema = @Schema(implementation = UploadExamResponse.class),
                            examples = @ExampleObject(name = "rejected", value = """
                                    {
                                      "valid": false,
                                      "errors": ["Unsupported question type at index 2"],
                                      "warnings": [],
                                      "examId": null,
                                      "assignmentsCreated": 0,
                                      "normalizedPreview": null
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Subject archived",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller does not manage the subject",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/upload")
    public ResponseEntity<UploadExamResponse> uploadExam(
            @Parameter(description = "Subject UUID the exam belongs to", required = true)
            @RequestParam(name = "subjectId") UUID subjectId,

            @RequestBody JsonNode payload,

            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(examService.uploadExam(caller, subjectId, payload));
    }

    @Operation(summary = "List exams visible to the caller")
    @GetMapping
    public ResponseEntity<List<ExamSummaryDto>> listExams(@AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(examService.listExams(caller));
    }

    @Operation(summary = "Get an exam with its questions")
    @GetMapping("/{examId}")
    public ResponseEntity<ExamDto> getExam(@PathVariable UUID examId,
                                           @AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(examService.getExam(caller, examId));
    }

    @Operation(summary = "Delete an exam", description = "Soft delete; existing assignments and attempts are kept.")
    @DeleteMapping("/{examId}")
    public ResponseEntity<Void> deleteExam(@PathVariable UUID examId,
                                           @AuthenticationPrincipal CallerContext caller) {
        examService.deleteExam(caller, examId);
        return ResponseEntity.noContent().build();
    }
}
