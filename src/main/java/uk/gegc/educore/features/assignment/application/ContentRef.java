package uk.gegc.educore.features.assignment.application;

import java.util.Objects;
import java.util.UUID;

/**
 * A newly published piece of subject content.
 */
public record ContentRef(Kind kind, UUID id) {

    public enum Kind {
        LESSON,
        EXAM
    }

    public ContentRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static ContentRef lesson(UUID lessonId) {
        return new ContentRef(Kind.LESSON, lessonId);
    }

    public static ContentRef exam(UUID examId) {
        return new ContentRef(Kind.EXAM, examId);
    }
}
