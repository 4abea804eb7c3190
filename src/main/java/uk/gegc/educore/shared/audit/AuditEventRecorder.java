package uk.gegc.educore.shared.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditEventRecorder {

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onAuditRecorded(AuditRecordedEvent event) {
        try {
            AuditEvent entry = new AuditEvent();
            entry.setTenantId(event.getTenantId());
            entry.setActorUserId(event.getActorUserId());
            entry.setActorRole(event.getActorRole());
            entry.setAction(event.getAction());
            entry.setEntityType(event.getEntityType());
            entry.setEntityId(event.getEntityId());
            entry.setMetadataJson(serialize(event));
            auditEventRepository.save(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {} for {} {}: {}",
                    event.getAction(), event.getEntityType(), event.getEntityId(), e.getMessage());
        }
    }

    private String serialize(AuditRecordedEvent event) {
        try {
            return objectMapper.writeValueAsString(event.getMetadata());
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata for {} could not be serialized: {}", event.getAction(), e.getMessage());
            return "{}";
        }
    }
}
