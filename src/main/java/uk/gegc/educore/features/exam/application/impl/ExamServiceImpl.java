package uk.gegc.educore.features.exam.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.assignment.application.AssignmentMaterializer;
import uk.gegc.educore.features.assignment.application.ContentRef;
import uk.gegc.educore.features.assignment.application.MaterializationResult;
import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.educore.features.exam.api.dto.ExamDto;
import uk.gegc.educore.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.educore.features.exam.api.dto.NormalizedPreview;
import uk.gegc.educore.features.exam.api.dto.UploadExamResponse;
import uk.gegc.educore.features.exam.application.ExamPayloadNormalizer;
import uk.gegc.educore.features.exam.application.ExamSchemaReader;
import uk.gegc.educore.features.exam.application.ExamService;
import uk.gegc.educore.features.exam.application.NormalizationResult;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.exam.domain.repository.ExamRepository;
import uk.gegc.educore.features.subject.application.SubjectService;
import uk.gegc.educore.features.subject.domain.model.Subject;
import uk.gegc.educore.features.subject.domain.repository.SubjectRepository;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ForbiddenException;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;
import uk.gegc.educore.shared.metrics.CoreMetricsService;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExamServiceImpl implements ExamService {

    private final ExamRepository examRepository;
    private final SubjectRepository subjectRepository;
    private final AssignmentRepository assignmentRepository;
    private final SubjectService subjectService;
    private final ExamPayloadNormalizer normalizer;
    private final ExamSchemaReader schemaReader;
    private final AssignmentMaterializer assignmentMaterializer;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final CoreMetricsService metricsService;

    @Override
    @Transactional
    public UploadExamResponse uploadExam(CallerContext caller, UUID subjectId, JsonNode payload) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Subject subject = subjectService.assertSubjectAccess(caller, subjectId);

        NormalizationResult result = normalizer.normalize(payload);
        if (!result.isValid()) {
            metricsService.incrementExamUpload(false);
            log.info("Rejected exam upload for subject {}: {} errors", subjectId, result.errors().size());
            return UploadExamResponse.rejected(result.errors(), result.warnings());
        }

        NormalizedExam normalized = result.normalized();
        Exam exam = new Exam();
        exam.setTenantId(caller.tenantId());
        exam.setSubjectId(subject.getId());
        exam.setTitle(normalized.title());
        exam.setSubjectName(subject.getName());
        exam.setSettingsJson(schemaReader.write(normalized.settings()));
        exam.setNormalizedJson(schemaReader.write(normalized));
        exam.setNormalizedSchemaVersion(Exam.SCHEMA_VERSION);
        exam.setUploadedById(caller.userId());
        Exam saved = examRepository.saveAndFlush(exam);

        MaterializationResult assignments = assignmentMaterializer.onContentPublished(subject, ContentRef.exam(saved.getId()));

        metricsService.incrementExamUpload(true);
        auditService.record(caller, "exam.upload", "exam", saved.getId(), Map.of(
                "title", saved.getTitle(),
                "subjectId", subject.getId()
        ));
        log.info("Exam {} '{}' uploaded to subject {} with {} questions; {} assignments created",
                saved.getId(), saved.getTitle(), subject.getId(), normalized.questions().size(), assignments.examCreated());

        return new UploadExamResponse(true, List.of(), result.warnings(), saved.getId(),
                assignments.examCreated(), NormalizedPreview.from(normalized));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExamSummaryDto> listExams(CallerContext caller) {
        List<Exam> exams;
        if (caller.isTenantAdmin()) {
            exams = examRepository.findAllByTenantIdAndDeletedFalseOrderByCreatedAtDesc(caller.tenantId());
        } else if (caller.isContentManager()) {
            exams = examRepository.findAllOwnedBy(caller.tenantId(), caller.userId());
        } else {
            Set<UUID> assignedExamIds = new LinkedHashSet<>();
            assignmentRepository.findAllByTenantIdAndAssigneeStudentIdOrderByCreatedAtDesc(caller.tenantId(), caller.userId())
                    .stream()
                    .map(Assignment::getExamId)
                    .filter(Objects::nonNull)
                    .forEach(assignedExamIds::add);
            exams = assignedExamIds.isEmpty()
                    ? List.of()
                    : examRepository.findAllByIdInAndDeletedFalseOrderByCreatedAtDesc(assignedExamIds);
        }
        return exams.stream().map(ExamSummaryDto::from).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ExamDto getExam(CallerContext caller, UUID examId) {
        Exam exam = findExam(caller, examId);
        NormalizedExam normalized = schemaReader.read(exam);

        List<NormalizedQuestion> questions;
        if (caller.isStudent()) {
            if (!assignmentRepository.existsByTenantIdAndAssigneeStudentIdAndExamId(caller.tenantId(), caller.userId(), examId)) {
                throw new ForbiddenException("Exam is not assigned to this student");
            }
            questions = normalized.questions().stream().map(NormalizedQuestion::withoutAnswerKey).toList();
        } else {
            requireSubjectOwnerOrAdmin(caller, exam, "Cannot access another owner's exams");
            questions = normalized.questions();
        }

        return new ExamDto(exam.getId(), exam.getSubjectId(), exam.getTitle(), exam.getSubjectName(),
                normalized.settings(), questions, exam.getCreatedAt());
    }

    @Override
    @Transactional
    public void deleteExam(CallerContext caller, UUID examId) {
        accessPolicy.requireContentManagerOrAdmin(caller);
        Exam exam = findExam(caller, examId);
        requireSubjectOwnerOrAdmin(caller, exam, "Cannot delete another owner's exams");
        exam.setDeleted(true);
        auditService.record(caller, "exam.delete", "exam", examId, Map.of("subjectId", exam.getSubjectId()));
        log.info("Exam {} deleted by {}", examId, caller.userId());
    }

    private Exam findExam(CallerContext caller, UUID examId) {
        return examRepository.findByIdAndTenantIdAndDeletedFalse(examId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + examId + " not found"));
    }

    private void requireSubjectOwnerOrAdmin(CallerContext caller, Exam exam, String message) {
        UUID ownerId = subjectRepository.findByIdAndTenantId(exam.getSubjectId(), caller.tenantId())
                .map(Subject::getTeacherOwnerId)
                .orElse(null);
        accessPolicy.requireOwnerOrTenantAdmin(caller, ownerId, message);
    }
}
