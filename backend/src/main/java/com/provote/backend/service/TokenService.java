package com.provote.backend.service;

import com.provote.backend.core.security.VoterPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates bearer tokens issued by the accounts service. The subject is the
 * user id; the "role" claim carries the authority.
 */
@Slf4j
@Service
public class TokenService {

    private final Key signKey;

    public TokenService(@Value("${jwt.secret}") String secret) {
        this.signKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<VoterPrincipal> validateToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            UUID userId = UUID.fromString(claims.getSubject());
            return Optional.of(new VoterPrincipal(userId, claims.get("role", String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            // expired, bad signature or a subject that is not a user id
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
