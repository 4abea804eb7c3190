package uk.gegc.educore.shared.audit;

import org.springframework.context.ApplicationEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published whenever a state-changing operation needs an audit trail entry.
 * The entry is written after the surrounding transaction commits.
 */
public class AuditRecordedEvent extends ApplicationEvent {

    private final UUID tenantId;
    private final UUID actorUserId;
    private final String actorRole;
    private final String action;
    private final String entityType;
    private final UUID entityId;
    private final Map<String, Object> metadata;

    public AuditRecordedEvent(Object source, UUID tenantId, UUID actorUserId, String actorRole,
                              String action, String entityType, UUID entityId, Map<String, Object> metadata) {
        super(source);
        this.tenantId = tenantId;
        this.actorUserId = actorUserId;
        this.actorRole = actorRole;
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public String getActorRole() {
        return actorRole;
    }

    public String getAction() {
        return action;
    }

    public String getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
