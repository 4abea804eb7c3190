package uk.gegc.educore.features.attempt.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One answer within one attempt. {@code answerJson} holds the raw JSON answer as submitted;
 * {@code gradingJson} is filled in when the attempt is graded.
 */
@Entity
@Getter
@Setter
@Table(name = "attempt_responses",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_attempt_responses_question",
                columnNames = {"attempt_id", "question_id"}))
public class AttemptResponse {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "attempt_id", nullable = false, updatable = false)
    private UUID attemptId;

    @Column(name = "question_id", nullable = false, updatable = false, length = 120)
    private String questionId;

    @Column(name = "answer_json", columnDefinition = "TEXT")
    private String answerJson;

    @Column(name = "grading_json", columnDefinition = "TEXT")
    private String gradingJson;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
