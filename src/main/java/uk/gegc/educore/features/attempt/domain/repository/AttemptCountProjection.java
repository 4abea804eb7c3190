package uk.gegc.educore.features.attempt.domain.repository;

import java.util.UUID;

public interface AttemptCountProjection {

    UUID getAssignmentId();

    long getAttemptCount();
}
