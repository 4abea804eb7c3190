package uk.gegc.educore.features.grading.application.grader;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.educore.features.exam.domain.model.QuestionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class GraderFactory {
    private final Map<QuestionType, QuestionGrader> graderMap = new EnumMap<>(QuestionType.class);

    public GraderFactory(List<QuestionGrader> graders) {
        graders.forEach(grader -> grader.supportedTypes().forEach(type -> graderMap.put(type, grader)));
        log.info("GraderFactory initialized with graders for types: {}", graderMap.keySet());
    }

    public QuestionGrader getGrader(QuestionType type) {
        QuestionGrader grader = graderMap.get(type);
        if (grader == null) {
            throw new UnsupportedOperationException("No grader for type " + type);
        }
        return grader;
    }
}
