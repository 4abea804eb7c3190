package uk.gegc.educore.shared.security;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Tenant-scoped roles a caller can act under. Only one role is active per request.
 */
public enum RoleKey {
    PLATFORM_ADMIN,
    SCHOOL_ADMIN,
    TEACHER,
    STUDENT,
    PARENT,
    TUTOR;

    public boolean isContentManager() {
        return this == TEACHER || this == PARENT || this == TUTOR;
    }

    public boolean isTenantAdmin() {
        return this == SCHOOL_ADMIN || this == PLATFORM_ADMIN;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoleKey> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst();
    }
}
