package uk.gegc.educore.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.educore.shared.exception.ForbiddenException;

import java.util.UUID;

/**
 * Thin facade applying role and ownership rules in a single place so feature
 * services stay focused on business logic.
 */
@Component
@Slf4j
public class AccessPolicy {

    private static final String DEFAULT_FORBIDDEN_MESSAGE = "Access denied";

    public boolean isOwner(CallerContext caller, UUID ownerId) {
        return caller != null && ownerId != null && ownerId.equals(caller.userId());
    }

    public void requireStudent(CallerContext caller) {
        if (caller == null || !caller.isStudent()) {
            throwForbidden("Only students can perform this action");
        }
    }

    public void requireContentManagerOrAdmin(CallerContext caller) {
        if (caller == null || !caller.canManageContent()) {
            throwForbidden("Content manager or tenant admin role required");
        }
    }

    /**
     * Passes for tenant admins and for the owning content manager.
     */
    public void requireOwnerOrTenantAdmin(CallerContext caller, UUID ownerId, String message) {
        if (caller == null) {
            throwForbidden(DEFAULT_FORBIDDEN_MESSAGE);
        }
        if (caller.isTenantAdmin()) {
            return;
        }
        if (caller.isContentManager() && isOwner(caller, ownerId)) {
            return;
        }
        throwForbidden(message != null ? message : DEFAULT_FORBIDDEN_MESSAGE);
    }

    public void requireSameTenant(CallerContext caller, UUID tenantId) {
        if (caller == null || tenantId == null || !tenantId.equals(caller.tenantId())) {
            throwForbidden(DEFAULT_FORBIDDEN_MESSAGE);
        }
    }

    private void throwForbidden(String message) {
        log.debug("Access denied: {}", message);
        throw new ForbiddenException(message);
    }
}
