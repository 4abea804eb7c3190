package uk.gegc.educore.features.subject.api;

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
import uk.gegc.educore.features.subject.api.dto.*;
import uk.gegc.educore.features.subject.application.SubjectService;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

@Tag(name = "Subjects", description = "Subjects, enrollments and enrollment-driven auto-assignment")
@RestController
@RequestMapping("/api/v1/subjects")
@RequiredArgsConstructor
@Validated
public class SubjectController {

    private final SubjectService subjectService;

    @Operation(summary = "Create a subject",
            description = "Content managers own the subjects they create; admins must name the owner.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Subject created",
                    content = @Content(schema = @Schema(implementation = SubjectDto.class))),
            @ApiResponse(responseCode = "409", description = "Name already used by this owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SubjectDto> createSubject(
            @RequestBody @Valid CreateSubjectRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(subjectService.createSubject(caller, request));
    }

    @Operation(summary = "List subjects", description = "Content managers only see their own subjects.")
    @GetMapping
    public ResponseEntity<List<SubjectDto>> listSubjects(
            @Parameter(description = "Filter by owning teacher (admins only)")
            @RequestParam(name = "teacherId", required = false) UUID teacherId,

            @Parameter(description = "Include archived subjects", example = "false")
            @RequestParam(name = "includeArchived", defaultValue = "false") boolean includeArchived,

            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(subjectService.listSubjects(caller, teacherId, includeArchived));
    }

    @Operation(summary = "Rename or archive a subject")
    @PatchMapping("/{subjectId}")
    public ResponseEntity<SubjectDto> updateSubject(
            @PathVariable UUID subjectId,
            @RequestBody @Valid UpdateSubjectRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(subjectService.updateSubject(caller, subjectId, request));
    }

    @Operation(summary = "List enrollments of a subject")
    @GetMapping("/{subjectId}/students")
    public ResponseEntity<List<SubjectEnrollmentDto>> listEnrollments(
            @PathVariable UUID subjectId,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(subjectService.listEnrollments(caller, subjectId));
    }

    @Operation(summary = "Enroll a student",
            description = "Creates or reactivates the enrollment and assigns every existing lesson and exam of the subject.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Enrollment active",
                    content = @Content(schema = @Schema(implementation = EnrollmentChangeResponse.class))),
            @ApiResponse(responseCode = "400", description = "Subject archived or student not in tenant",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{subjectId}/students")
    public ResponseEntity<EnrollmentChangeResponse> enrollStudent(
            @PathVariable UUID subjectId,
            @RequestBody @Valid EnrollStudentRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(subjectService.enrollStudent(caller, subjectId, request));
    }

    @Operation(summary = "Complete or reactivate an enrollment")
    @PatchMapping("/{subjectId}/students/{studentId}")
    public ResponseEntity<EnrollmentChangeResponse> updateEnrollment(
            @PathVariable UUID subjectId,
            @PathVariable UUID studentId,
            @RequestBody @Valid UpdateEnrollmentRequest request,
            @AuthenticationPrincipal CallerContext caller
    ) {
        return ResponseEntity.ok(subjectService.updateEnrollment(caller, subjectId, studentId, request));
    }
}
