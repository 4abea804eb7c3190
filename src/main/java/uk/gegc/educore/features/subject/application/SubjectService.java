package uk.gegc.educore.features.subject.application;

import uk.gegc.educore.features.subject.api.dto.CreateSubjectRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollStudentRequest;
import uk.gegc.educore.features.subject.api.dto.EnrollmentChangeResponse;
import uk.gegc.educore.features.subject.api.dto.SubjectDto;
import uk.gegc.educore.features.subject.api.dto.SubjectEnrollmentDto;
import uk.gegc.educore.features.subject.api.dto.UpdateEnrollmentRequest;
import uk.gegc.educore.features.subject.api.dto.UpdateSubjectRequest;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

public interface SubjectService {

    SubjectDto createSubject(CallerContext caller, CreateSubjectRequest request);

    List<SubjectDto> listSubjects(CallerContext caller, UUID teacherId, boolean includeArchived);

    SubjectDto updateSubject(CallerContext caller, UUID subjectId, UpdateSubjectRequest request);

    List<SubjectEnrollmentDto> listEnrollments(CallerContext caller, UUID subjectId);

    EnrollmentChangeResponse enrollStudent(CallerContext caller, UUID subjectId, EnrollStudentRequest request);

    EnrollmentChangeResponse updateEnrollment(CallerContext caller, UUID subjectId, UUID studentId,
                                              UpdateEnrollmentRequest request);

    /**
     * Loads a subject the caller manages, archived or not.
     */
    Subject requireManagedSubject(CallerContext caller, UUID subjectId);

    /**
     * Loads a subject the caller may publish content into or assign from.
     *
     * @throws uk.gegc.educore.shared.exception.ResourceNotFoundException if absent from the caller's tenant
     * @throws uk.gegc.educore.shared.exception.ForbiddenException        if the caller does not manage it
     * @throws uk.gegc.educore.shared.exception.ValidationException       if it is archived
     */
    Subject assertSubjectAccess(CallerContext caller, UUID subjectId);

    /**
     * Makes sure the student has an enrollment in the subject, creating one with
     * auto-assignment off when missing. Safe to call repeatedly.
     */
    ManualEnrollmentResult ensureEnrollmentForManualAssignment(CallerContext caller, Subject subject, UUID studentId);
}
