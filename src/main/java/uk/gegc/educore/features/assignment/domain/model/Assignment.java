package uk.gegc.educore.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One lesson or exam assigned to one student. Exactly one of {@code lessonId} and
 * {@code examId} is set.
 * <p>
 * Rows created by auto-assignment carry {@code autoAssignKey}, which is unique per
 * (enrollment, content) pair; manual rows leave it {@code null}.
 */
@Entity
@Getter
@Setter
@Table(name = "assignments",
        uniqueConstraints = @UniqueConstraint(name = "uk_assignments_auto_key", columnNames = "auto_assign_key"))
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "assignee_student_id", nullable = false, updatable = false)
    private UUID assigneeStudentId;

    @Column(name = "assigned_by_teacher_id", nullable = false)
    private UUID assignedByTeacherId;

    @Column(name = "lesson_id")
    private UUID lessonId;

    @Column(name = "exam_id")
    private UUID examId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_source", nullable = false, length = 20)
    private AssignmentSource assignmentSource;

    @Column(name = "subject_enrollment_id")
    private UUID subjectEnrollmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_type", nullable = false, length = 20)
    private AssignmentType assignmentType;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "due_at")
    private Instant dueAt;

    @Column(name = "auto_assign_key", length = 120)
    private String autoAssignKey;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static String autoKeyForLesson(UUID enrollmentId, UUID lessonId) {
        return enrollmentId + ":lesson:" + lessonId;
    }

    public static String autoKeyForExam(UUID enrollmentId, UUID examId) {
        return enrollmentId + ":exam:" + examId;
    }
}
