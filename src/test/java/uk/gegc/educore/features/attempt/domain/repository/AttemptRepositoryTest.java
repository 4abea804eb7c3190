package uk.gegc.educore.features.attempt.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.educore.features.attempt.domain.model.Attempt;
import uk.gegc.educore.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class AttemptRepositoryTest {

    private static final UUID TENANT = UUID.randomUUID();

    @Autowired
    private AttemptRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private Attempt persistAttempt(UUID assignmentId, UUID studentId, AttemptStatus status) {
        Attempt attempt = new Attempt();
        attempt.setTenantId(TENANT);
        attempt.setAssignmentId(assignmentId);
        attempt.setExamId(UUID.randomUUID());
        attempt.setStudentId(studentId);
        attempt.setStatus(status);
        return entityManager.persistAndFlush(attempt);
    }

    @Test
    @DisplayName("markSubmitted succeeds once; the second call sees no in-progress row")
    void markSubmitted_onlyOnce() {
        UUID studentId = UUID.randomUUID();
        Attempt attempt = persistAttempt(UUID.randomUUID(), studentId, AttemptStatus.IN_PROGRESS);
        Instant submittedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        int first = repository.markSubmitted(attempt.getId(), TENANT, studentId, submittedAt);
        int second = repository.markSubmitted(attempt.getId(), TENANT, studentId, submittedAt.plusSeconds(5));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Attempt stored = repository.findById(attempt.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AttemptStatus.SUBMITTED);
        assertThat(stored.getSubmittedAt()).isEqualTo(submittedAt);
    }

    @Test
    @DisplayName("markSubmitted ignores attempts of other students")
    void markSubmitted_wrongStudent() {
        Attempt attempt = persistAttempt(UUID.randomUUID(), UUID.randomUUID(), AttemptStatus.IN_PROGRESS);

        assertThat(repository.markSubmitted(attempt.getId(), TENANT, UUID.randomUUID(), Instant.now())).isZero();
        assertThat(repository.findById(attempt.getId()))
                .hasValueSatisfying(row -> assertThat(row.getStatus()).isEqualTo(AttemptStatus.IN_PROGRESS));
    }

    @Test
    @DisplayName("attempt counts include every status and group by assignment")
    void countByAssignmentIds() {
        UUID studentId = UUID.randomUUID();
        UUID busy = UUID.randomUUID();
        UUID quiet = UUID.randomUUID();
        persistAttempt(busy, studentId, AttemptStatus.GRADED);
        persistAttempt(busy, studentId, AttemptStatus.NEEDS_REVIEW);
        persistAttempt(busy, studentId, AttemptStatus.IN_PROGRESS);
        persistAttempt(quiet, studentId, AttemptStatus.GRADED);

        Map<UUID, Long> counts = repository.countByAssignmentIds(List.of(busy, quiet, UUID.randomUUID())).stream()
                .collect(Collectors.toMap(AttemptCountProjection::getAssignmentId, AttemptCountProjection::getAttemptCount));

        assertThat(counts).containsOnly(Map.entry(busy, 3L), Map.entry(quiet, 1L));
        assertThat(repository.countByAssignmentIdAndStudentId(busy, studentId)).isEqualTo(3);
        assertThat(repository.existsByAssignmentIdAndStudentIdAndStatus(busy, studentId, AttemptStatus.IN_PROGRESS)).isTrue();
    }
}
