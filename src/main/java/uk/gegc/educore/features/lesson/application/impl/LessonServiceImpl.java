package uk.gegc.educore.features.lesson.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.assignment.application.AssignmentMaterializer;
import uk.gegc.educore.features.assignment.application.ContentRef;
import uk.gegc.educore.features.assignment.application.MaterializationResult;
import uk.gegc.educore.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.educore.features.lesson.api.dto.LessonDto;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonRequest;
import uk.gegc.educore.features.lesson.api.dto.PublishLessonResponse;
import uk.gegc.educore.features.lesson.application.LessonService;
import uk.gegc.educore.features.lesson.domain.model.Lesson;
import uk.gegc.educore.features.lesson.domain.repository.LessonRepository;
import uk.gegc.educore.features.subject.application.SubjectService;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LessonServiceImpl implements LessonService {

    private final LessonRepository lessonRepository;
    private final AssignmentRepository assignmentRepository;
    private final SubjectService subjectService;
    private final AssignmentMaterializer assignmentMaterializer;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;

    @Override
    @Transactional
    public PublishLessonResponse publishLesson(CallerContext caller, PublishLessonRequest request) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = subjectService.assertSubjectAccess(caller, request.subjectId());

        Lesson lesson = new Lesson();
        lesson.setTenantId(caller.tenantId());
        lesson.setSubjectId(subject.getId());
        lesson.setTitle(request.title().trim());
        lesson.setGradeLevel(request.gradeLevel());
        lesson.setContentPath(request.contentPath());
        lesson.setUploadedById(caller.userId());
        Lesson saved = lessonRepository.saveAndFlush(lesson);

        MaterializationResult assignments = assignmentMaterializer.onContentPublished(subject, ContentRef.lesson(saved.getId()));

        auditService.record(caller, "lesson.upload", "lesson", saved.getId(), Map.of(
                "subjectId", subject.getId(),
                "title", saved.getTitle(),
                "assignedStudents", assignments.lessonCreated()
        ));
        log.info("Lesson {} published in subject {}; {} assignments created",
                saved.getId(), subject.getId(), assignments.lessonCreated());
        return new PublishLessonResponse(LessonDto.from(saved), assignments.lessonCreated());
    }

    @Override
    @Transactional(readOnly = true)
    public List<LessonDto> listLessons(CallerContext caller, UUID subjectId) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = subjectService.requireManagedSubject(caller, subjectId);
        return lessonRepository.findAllByTenantIdAndSubjectIdAndDeletedFalseOrderByCreatedAtAsc(caller.tenantId(), subject.getId())
                .stream()
                .map(LessonDto::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public LessonDto getLesson(CallerContext caller, UUID lessonId) {
        Lesson lesson = findLesson(caller, lessonId);
        if (caller.isStudent()) {
            if (!assignmentRepository.existsByTenantIdAndAssigneeStudentIdAndLessonId(caller.tenantId(), caller.userId(), lessonId)) {
                throw new ResourceNotFoundException("Lesson " + lessonId + " not found");
            }
        } else {
            accessPolicy.requireOwnerOrTenantAdmin(caller, lesson.getUploadedById(), "Cannot access another teacher's lesson");
        }
        return LessonDto.from(lesson);
    }

    @Override
    @Transactional
    public void deleteLesson(CallerContext caller, UUID lessonId) {
        Lesson lesson = findLesson(caller, lessonId);
        accessPolicy.requireOwnerOrTenantAdmin(caller, lesson.getUploadedById(), "Cannot delete another teacher's lesson");
        lesson.setDeleted(true);
        auditService.record(caller, "lesson.delete", "lesson", lessonId, Map.of("subjectId", lesson.getSubjectId()));
    }

    private Lesson findLesson(CallerContext caller, UUID lessonId) {
        return lessonRepository.findByIdAndTenantIdAndDeletedFalse(lessonId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Lesson " + lessonId + " not found"));
    }
}
