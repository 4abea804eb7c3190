package uk.gegc.educore.features.attempt.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.educore.features.assignment.domain.model.Assignment;
import uk.gegc.educore.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.educore.features.attempt.api.dto.AttemptDto;
import uk.gegc.educore.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.educore.features.attempt.api.dto.ResponseEntry;
import uk.gegc.educore.features.attempt.api.dto.ResponseResultDto;
import uk.gegc.educore.features.attempt.api.dto.SaveResponsesRequest;
import uk.gegc.educore.features.attempt.api.dto.SaveResponsesResponse;
import uk.gegc.educore.features.attempt.api.dto.SubmissionDto;
import uk.gegc.educore.features.attempt.application.AttemptGradingRecorder;
import uk.gegc.educore.features.attempt.application.AttemptJson;
import uk.gegc.educore.features.attempt.application.AttemptService;
import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptResponse;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;
import uk.gegc.educore.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.educore.features.attempt.domain.repository.AttemptResponseRepository;
import uk.gegc.educore.features.exam.application.ExamSchemaReader;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;
import uk.gegc.educore.features.exam.domain.repository.ExamRepository;
import uk.gegc.educore.features.grading.application.GradingPipeline;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;
import uk.gegc.educore.features.grading.domain.model.GradingOutcome;
import uk.gegc.educore.features.grading.domain.model.GradingSummary;
import uk.gegc.educore.shared.audit.AuditService;
import uk.gegc.educore.shared.exception.ConflictException;
import uk.gegc.educore.shared.exception.ForbiddenException;
import uk.gegc.educore.shared.exception.ResourceNotFoundException;
import uk.gegc.educore.shared.exception.ValidationException;
import uk.gegc.educore.shared.metrics.CoreMetricsService;
import uk.gegc.educore.shared.security.AccessPolicy;
import uk.gegc.educore.shared.security.CallerContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AttemptServiceImpl implements AttemptService {

    static final String ATTEMPT_NOT_FOUND = "Attempt not found";
    static final String IN_PROGRESS_EXISTS = "Complete the in-progress attempt before creating a new one";
    static final String MAX_ATTEMPTS_REACHED = "Maximum attempts reached for this assignment";
    static final String ALREADY_SUBMITTED = "Attempt is already submitted";

    private final AttemptRepository attemptRepository;
    private final AttemptResponseRepository responseRepository;
    private final AssignmentRepository assignmentRepository;
    private final ExamRepository examRepository;
    private final ExamSchemaReader schemaReader;
    private final GradingPipeline gradingPipeline;
    private final AttemptGradingRecorder gradingRecorder;
    private final AttemptJson attemptJson;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final CoreMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AttemptDto createAttempt(CallerContext caller, UUID assignmentId) {
        accessPolicy.requireStudent(caller);
        Assignment assignment = assignmentRepository.findByIdAndTenantId(assignmentId, caller.tenantId())
                .filter(found -> found.getAssigneeStudentId().equals(caller.userId()))
                .orElseThrow(() -> new ForbiddenException("Assignment is not available for this student"));

        if (assignment.getExamId() == null) {
            throw new ValidationException("This assignment does not include an exam");
        }
        examRepository.findByIdAndTenantIdAndDeletedFalse(assignment.getExamId(), caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Exam not found"));

        if (attemptRepository.existsByAssignmentIdAndStudentIdAndStatus(assignmentId, caller.userId(), AttemptStatus.IN_PROGRESS)) {
            throw new ConflictException(IN_PROGRESS_EXISTS);
        }
        long attemptsUsed = attemptRepository.countByAssignmentIdAndStudentId(assignmentId, caller.userId());
        if (attemptsUsed >= assignment.getMaxAttempts()) {
            throw new ConflictException(MAX_ATTEMPTS_REACHED);
        }

        Attempt attempt = new Attempt();
        attempt.setTenantId(caller.tenantId());
        attempt.setAssignmentId(assignmentId);
        attempt.setExamId(assignment.getExamId());
        attempt.setStudentId(caller.userId());
        attempt.setStatus(AttemptStatus.IN_PROGRESS);
        Attempt saved = attemptRepository.saveAndFlush(attempt);

        log.info("Attempt {} started on assignment {} by student {} ({}/{})",
                saved.getId(), assignmentId, caller.userId(), attemptsUsed + 1, assignment.getMaxAttempts());
        return AttemptDto.from(saved);
    }

    @Override
    @Transactional
    public SaveResponsesResponse saveResponses(CallerContext caller, UUID attemptId, SaveResponsesRequest request) {
        Attempt attempt = attemptRepository.findByIdAndTenantId(attemptId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException(ATTEMPT_NOT_FOUND));
        if (!attempt.getStudentId().equals(caller.userId())) {
            throw new ForbiddenException("Cannot modify another student's attempt");
        }
        if (attempt.getStatus() != AttemptStatus.IN_PROGRESS) {
            throw new ConflictException("Only in-progress attempts can be autosaved");
        }

        NormalizedExam exam = examRepository.findById(attempt.getExamId())
                .map(schemaReader::read)
                .orElseThrow(() -> new ResourceNotFoundException("Exam not found"));

        List<ResponseEntry> entries = request.responses();
        for (ResponseEntry entry : entries) {
            if (entry.questionId() == null || !exam.hasQuestion(entry.questionId()) || entry.answer() == null) {
                throw new ValidationException("Invalid response payload for question " + entry.questionId());
            }
        }

        Map<String, AttemptResponse> existing = responseRepository.findAllByAttemptId(attemptId).stream()
                .collect(Collectors.toMap(AttemptResponse::getQuestionId, Function.identity()));
        Map<String, AttemptResponse> toSave = new LinkedHashMap<>();
        for (ResponseEntry entry : entries) {
            AttemptResponse response = toSave.computeIfAbsent(entry.questionId(), questionId -> {
                AttemptResponse current = existing.get(questionId);
                if (current != null) {
                    return current;
                }
                AttemptResponse created = new AttemptResponse();
                created.setAttemptId(attemptId);
                created.setQuestionId(questionId);
                return created;
            });
            response.setAnswerJson(attemptJson.write(entry.answer()));
        }
        responseRepository.saveAll(toSave.values());

        log.debug("Autosaved {} responses for attempt {}", toSave.size(), attemptId);
        return new SaveResponsesResponse(attemptId, toSave.size());
    }

    @Override
    public SubmissionDto submitAttempt(CallerContext caller, UUID attemptId) {
        Attempt attempt = attemptRepository.findByIdAndTenantId(attemptId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException(ATTEMPT_NOT_FOUND));
        requireSubmittable(caller, attempt);

        NormalizedExam exam = examRepository.findById(attempt.getExamId())
                .map(schemaReader::read)
                .orElseThrow(() -> new ValidationException(ExamSchemaReader.MALFORMED_SCHEMA));

        Instant submittedAt = Instant.now(clock);
        int transitioned = attemptRepository.markSubmitted(attemptId, caller.tenantId(), caller.userId(), submittedAt);
        if (transitioned == 0) {
            Attempt current = attemptRepository.findByIdAndTenantId(attemptId, caller.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException(ATTEMPT_NOT_FOUND));
            requireSubmittable(caller, current);
            throw new ConflictException(ALREADY_SUBMITTED);
        }
        log.info("Attempt {} submitted by student {}", attemptId, caller.userId());

        Map<String, JsonNode> answers = new HashMap<>();
        for (AttemptResponse response : responseRepository.findAllByAttemptId(attemptId)) {
            JsonNode answer = attemptJson.readTree(response.getAnswerJson());
            if (answer != null) {
                answers.put(response.getQuestionId(), answer);
            }
        }

        GradingOutcome outcome = gradingPipeline.grade(exam, answers);
        Attempt graded = gradingRecorder.record(attemptId, outcome, answers, Instant.now(clock));

        metricsService.incrementAttemptSubmitted(graded.getStatus().name().toLowerCase(Locale.ROOT));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", graded.getStatus().name());
        metadata.put("scorePercent", graded.getScorePercent());
        auditService.record(caller, "attempt.submit", "attempt", attemptId, metadata);

        return new SubmissionDto(graded.getId(), graded.getStatus(), graded.getScorePercent(),
                submittedAt, graded.getGradedAt(), outcome.summary());
    }

    @Override
    @Transactional(readOnly = true)
    public AttemptResultDto getAttemptResult(CallerContext caller, UUID attemptId) {
        Attempt attempt = attemptRepository.findByIdAndTenantId(attemptId, caller.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException(ATTEMPT_NOT_FOUND));

        if (caller.isStudent()) {
            if (!attempt.getStudentId().equals(caller.userId())) {
                throw new ForbiddenException("Students can only view their own results");
            }
        } else if (!caller.isTenantAdmin()) {
            UUID issuerId = assignmentRepository.findByIdAndTenantId(attempt.getAssignmentId(), caller.tenantId())
                    .map(Assignment::getAssignedByTeacherId)
                    .orElse(null);
            if (!caller.isContentManager() || !accessPolicy.isOwner(caller, issuerId)) {
                throw new ForbiddenException("Owner does not have access to this attempt");
            }
        }

        String examTitle = examRepository.findById(attempt.getExamId()).map(Exam::getTitle).orElse(null);
        List<ResponseResultDto> responses = new ArrayList<>();
        for (AttemptResponse response : responseRepository.findAllByAttemptIdOrderByQuestionIdAsc(attemptId)) {
            responses.add(new ResponseResultDto(
                    response.getQuestionId(),
                    attemptJson.readTree(response.getAnswerJson()),
                    attemptJson.read(response.getGradingJson(), GradedQuestion.class)
            ));
        }

        return new AttemptResultDto(
                attempt.getId(),
                attempt.getAssignmentId(),
                attempt.getExamId(),
                examTitle,
                attempt.getStudentId(),
                attempt.getStatus(),
                attempt.getScorePercent(),
                attempt.getStartedAt(),
                attempt.getSubmittedAt(),
                attempt.getGradedAt(),
                attemptJson.read(attempt.getGradingSummaryJson(), GradingSummary.class),
                responses
        );
    }

    private static void requireSubmittable(CallerContext caller, Attempt attempt) {
        if (!attempt.getStudentId().equals(caller.userId())) {
            throw new ForbiddenException("Cannot submit another student's attempt");
        }
        if (attempt.getStatus() != AttemptStatus.IN_PROGRESS) {
            throw new ConflictException(ALREADY_SUBMITTED);
        }
    }
}
