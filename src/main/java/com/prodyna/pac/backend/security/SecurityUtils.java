package com.prodyna.pac.backend.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.Optional;

/**
 * Access to the identity verified for the current request.
 *
 * @author PAC Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the subject of the verified bearer token of the current request.
     *
     * @return Token subject, or empty if the request is not authenticated
     */
    public static Optional<String> currentSubject() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return Optional.empty();
        }
        if (authentication instanceof JwtAuthenticationToken) {
            return Optional.ofNullable(((JwtAuthenticationToken) authentication).getToken().getSubject());
        }
        return Optional.ofNullable(authentication.getName());
    }

    /**
     * Subject of the current request for audit logs.
     *
     * @return Token subject, or "anonymous"
     */
    public static String currentSubjectOrAnonymous() {
        return currentSubject().orElse("anonymous");
    }
}
