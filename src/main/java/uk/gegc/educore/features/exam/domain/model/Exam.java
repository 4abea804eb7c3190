package uk.gegc.educore.features.exam.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored exam. The canonical question set lives in {@code normalizedJson} as the JSON
 * form of a {@link NormalizedExam}, tagged with {@code normalizedSchemaVersion}.
 */
@Entity
@Getter
@Setter
@Table(name = "exams")
public class Exam {

    public static final String SCHEMA_VERSION = "v1";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "subject_name", nullable = false, length = 120)
    private String subjectName;

    @Column(name = "settings_json", columnDefinition = "TEXT")
    private String settingsJson;

    @Column(name = "normalized_json", columnDefinition = "LONGTEXT")
    private String normalizedJson;

    @Column(name = "normalized_schema_version", length = 10)
    private String normalizedSchemaVersion;

    @Column(name = "uploaded_by_id", nullable = false, updatable = false)
    private UUID uploadedById;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
