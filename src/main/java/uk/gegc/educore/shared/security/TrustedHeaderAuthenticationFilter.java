package uk.gegc.educore.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds a {@link CallerContext} from the identity headers set by the API gateway.
 * Sessions and tokens are issued and verified upstream; requests without a complete
 * header set stay anonymous and are rejected by the security chain.
 */
@Slf4j
public class TrustedHeaderAuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String TENANT_ID_HEADER = "X-Tenant-Id";
    public static final String ACTIVE_ROLE_HEADER = "X-Active-Role";
    public static final String PLATFORM_ADMIN_HEADER = "X-Platform-Admin";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            resolveCaller(request).ifPresent(caller -> {
                var authentication = new UsernamePasswordAuthenticationToken(caller, null, authoritiesOf(caller));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            });
        }
        filterChain.doFilter(request, response);
    }

    Optional<CallerContext> resolveCaller(HttpServletRequest request) {
        Optional<UUID> userId = parseUuid(request.getHeader(USER_ID_HEADER));
        Optional<UUID> tenantId = parseUuid(request.getHeader(TENANT_ID_HEADER));
        Optional<RoleKey> role = RoleKey.fromKey(request.getHeader(ACTIVE_ROLE_HEADER));
        if (userId.isEmpty() || tenantId.isEmpty() || role.isEmpty()) {
            return Optional.empty();
        }
        boolean platformAdmin = Boolean.parseBoolean(request.getHeader(PLATFORM_ADMIN_HEADER));
        return Optional.of(new CallerContext(userId.get(), tenantId.get(), role.get(), platformAdmin));
    }

    static List<GrantedAuthority> authoritiesOf(CallerContext caller) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + caller.activeRole().name()));
        if (caller.platformAdmin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_" + RoleKey.PLATFORM_ADMIN.name()));
        }
        return authorities;
    }

    private static Optional<UUID> parseUuid(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed identity header value '{}'", raw);
            return Optional.empty();
        }
    }
}
