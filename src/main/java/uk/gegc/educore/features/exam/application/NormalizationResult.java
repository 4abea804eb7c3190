package uk.gegc.educore.features.exam.application;

import uk.gegc.educore.features.exam.domain.model.NormalizedExam;

import java.util.List;

/**
 * Outcome of normalizing an uploaded exam. {@code normalized} is {@code null} whenever
 * {@code errors} is non-empty.
 */
public record NormalizationResult(NormalizedExam normalized, List<String> errors, List<String> warnings) {

    public NormalizationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return normalized != null && errors.isEmpty();
    }
}
