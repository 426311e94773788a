package com.familybudget.budget.security;

import java.util.Optional;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Resolves the owner whose data a request may read from the bearer token subject.
 */
@Component
public class AuthenticatedUserProvider {

    public UUID requireCurrentOwnerId() {
        return currentOwnerId().orElseThrow(() -> new IllegalStateException("owner context missing"));
    }

    public Optional<UUID> currentOwnerId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken jwtAuthentication) {
            try {
                return Optional.of(UUID.fromString(jwtAuthentication.getName()));
            } catch (IllegalArgumentException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
