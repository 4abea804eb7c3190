package uk.gegc.educore.shared.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the caller for one request, resolved upstream and trusted here.
 */
public record CallerContext(UUID userId, UUID tenantId, RoleKey activeRole, boolean platformAdmin) {

    public CallerContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(activeRole, "activeRole");
    }

    public boolean isStudent() {
        return activeRole == RoleKey.STUDENT;
    }

    public boolean isContentManager() {
        return activeRole.isContentManager();
    }

    public boolean isTenantAdmin() {
        return platformAdmin || activeRole.isTenantAdmin();
    }

    public boolean canManageContent() {
        return isContentManager() || isTenantAdmin();
    }
}
