package uk.gegc.educore.features.exam.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.domain.model.Exam;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;
import uk.gegc.educore.shared.exception.ValidationException;

/**
 * Reads and writes the stored canonical form of an exam.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExamSchemaReader {

    public static final String MALFORMED_SCHEMA = "Exam schema is missing or malformed";

    private final ObjectMapper objectMapper;

    /**
     * @throws ValidationException if the exam has no stored schema, an unknown schema
     *                             version, or JSON that does not describe any question
     */
    public NormalizedExam read(Exam exam) {
        if (exam.getNormalizedJson() == null || exam.getNormalizedJson().isBlank()
                || !Exam.SCHEMA_VERSION.equals(exam.getNormalizedSchemaVersion())) {
            throw new ValidationException(MALFORMED_SCHEMA);
        }
        NormalizedExam normalized;
        try {
            normalized = objectMapper.readValue(exam.getNormalizedJson(), NormalizedExam.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored schema of exam {} cannot be parsed: {}", exam.getId(), e.getOriginalMessage());
            throw new ValidationException(MALFORMED_SCHEMA);
        }
        if (normalized.questions().isEmpty()
                || normalized.questions().stream().anyMatch(q -> q == null || q.id() == null || q.type() == null)) {
            throw new ValidationException(MALFORMED_SCHEMA);
        }
        return normalized;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize exam schema", e);
        }
    }
}
