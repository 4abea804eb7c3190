package uk.gegc.educore.features.assignment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
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
import uk.gegc.educore.features.assignment.api.dto.AssignmentDto;
import uk.gegc.educore.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.educore.features.assignment.api.dto.MyAssignmentDto;
import uk.gegc.educore.features.assignment.application.AssignmentService;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;

@Tag(name = "Assignments", description = "Manual assignment and the student's assignment list")
@RestController
@RequestMapping("/api/v1/assignments")
@RequiredArgsConstructor
@Validated
public class AssignmentController {

    private final AssignmentService assignmentService;

    @Operation(summary = "Assign a lesson or an exam to students")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assignments created",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = AssignmentDto.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid target, students or limits",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Lesson or exam not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<List<AssignmentDto>> createAssignments(
            @RequestBody @Valid CreateAssignmentRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assignmentService.createAssignments(caller, request));
    }

    @Operation(summary = "List the calling student's assignments with attempts used")
    @GetMapping("/my")
    public ResponseEntity<List<MyAssignmentDto>> getMyAssignments(@AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(assignmentService.getMyAssignments(caller));
    }
}
