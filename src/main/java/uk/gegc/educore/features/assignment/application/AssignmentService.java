package uk.gegc.educore.features.assignment.application;

import uk.gegc.educore.features.assignment.api.dto.AssignmentDto;
import uk.gegc.educore.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.educore.features.assignment.api.dto.MyAssignmentDto;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;

public interface AssignmentService {

    /**
     * Creates manual assignments, enrolling each student in the content's subject first
     * when they are not enrolled yet.
     */
    List<AssignmentDto> createAssignments(CallerContext caller, CreateAssignmentRequest request);

    List<MyAssignmentDto> getMyAssignments(CallerContext caller);
}
