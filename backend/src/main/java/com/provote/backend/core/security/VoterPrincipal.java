package com.provote.backend.core.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.UUID;

/**
 * Authenticated caller, built from the bearer token. Accounts live in the
 * identity service; this backend only trusts the signed claims.
 */
public record VoterPrincipal(UUID userId, String role) {

    public static final String ADMIN = "ADMIN";

    public List<GrantedAuthority> authorities() {
        if (role == null || role.isBlank()) {
            return List.of();
        }
        return List.of(new SimpleGrantedAuthority(role));
    }

    public boolean isAdmin() {
        return ADMIN.equals(role);
    }
}
