package uk.gegc.educore.features.exam.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.educore.features.exam.api.dto.ExamDto;
import uk.gegc.educore.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.educore.features.exam.api.dto.UploadExamResponse;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

public interface ExamService {

    /**
     * Normalizes the payload and, when valid, stores the exam and assigns it to every
     * active enrollment of the subject with auto-assignment on. An invalid payload is
     * returned as {@code valid = false} with nothing stored.
     */
    UploadExamResponse uploadExam(CallerContext caller, UUID subjectId, JsonNode payload);

    List<ExamSummaryDto> listExams(CallerContext caller);

    ExamDto getExam(CallerContext caller, UUID examId);

    void deleteExam(CallerContext caller, UUID examId);
}
