package uk.gegc.educore.shared.security;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default resolver used when no tenancy module is deployed next to the core.
 * Every id is treated as an active member; the gateway has already scoped the caller
 * to the tenant. A tenancy module replaces it by declaring its own
 * {@link TenantMembershipResolver} bean.
 */
@Component
public class TrustingTenantMembershipResolver implements TenantMembershipResolver {

    @Override
    public boolean isActiveStudent(UUID tenantId, UUID userId) {
        return tenantId != null && userId != null;
    }

    @Override
    public boolean isActiveContentManager(UUID tenantId, UUID userId) {
        return tenantId != null && userId != null;
    }
}
