package uk.gegc.educore.shared.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget audit sink. Callers never wait for, nor fail on, the write.
 */
@Service
@RequiredArgsConstructor
public class AuditService {

    private final ApplicationEventPublisher eventPublisher;

    public void record(CallerContext caller, String action, String entityType, UUID entityId, Map<String, Object> metadata) {
        eventPublisher.publishEvent(new AuditRecordedEvent(
                this,
                caller.tenantId(),
                caller.userId(),
                caller.activeRole().key(),
                action,
                entityType,
                entityId,
                metadata
        ));
    }
}
