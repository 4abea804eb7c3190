package uk.gegc.educore.testsupport;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import uk.gegc.educore.shared.security.CallerContext;

import java.util.List;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;

/**
 * Authenticates a MockMvc request as the given caller, the way the header filter would.
 */
public final class CallerAuthentication {

    private CallerAuthentication() {
    }

    public static RequestPostProcessor as(CallerContext caller) {
        return authentication(new UsernamePasswordAuthenticationToken(caller, null,
                List.of(new SimpleGrantedAuthority("ROLE_" + caller.activeRole().name()))));
    }
}
