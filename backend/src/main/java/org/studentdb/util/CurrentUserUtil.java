package org.studentdb.util;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the name recorded as the author of a change.
 */
@Component
public class CurrentUserUtil {

    /**
     * @return the authenticated principal's name, or {@code null} when the call
     *         does not come from an authenticated user (scheduled jobs, tests, migrations)
     */
    public String getCurrentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return auth.getName();
    }
}
