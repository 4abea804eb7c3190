package uk.gegc.educore.features.subject.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A student's membership in a subject. Rows are never deleted; completion is a status.
 */
@Entity
@Getter
@Setter
@Table(name = "subject_enrollments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_subject_enrollments_student",
                columnNames = {"tenant_id", "subject_id", "student_id"}))
public class SubjectEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EnrollmentStatus status = EnrollmentStatus.ACTIVE;

    @Column(name = "auto_assign_future", nullable = false)
    private boolean autoAssignFuture = true;

    @Column(name = "enrolled_by_user_id", nullable = false)
    private UUID enrolledByUserId;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "completed_by_user_id")
    private UUID completedByUserId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE;
    }
}
