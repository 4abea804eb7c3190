package uk.gegc.educore.shared.security;

import java.util.UUID;

/**
 * SPI that the tenancy module implements to answer membership questions.
 * {@link AccessPolicy} and the assignment services depend on this interface
 * so the core stays decoupled from how memberships are stored.
 */
public interface TenantMembershipResolver {

    boolean isActiveStudent(UUID tenantId, UUID userId);

    default boolean isActiveContentManager(UUID tenantId, UUID userId) {
        return false;
    }
}
