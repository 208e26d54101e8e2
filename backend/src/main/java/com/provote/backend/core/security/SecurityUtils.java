package com.provote.backend.core.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;
import java.util.UUID;

public class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<VoterPrincipal> currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof VoterPrincipal) {
            return Optional.of((VoterPrincipal) authentication.getPrincipal());
        }
        return Optional.empty();
    }

    // null for anonymous voters
    public static UUID currentUserId() {
        return currentPrincipal().map(VoterPrincipal::userId).orElse(null);
    }
}
