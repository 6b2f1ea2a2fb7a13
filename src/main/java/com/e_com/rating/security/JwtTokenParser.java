package com.e_com.rating.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;

/**
 * Reads the actor from a bearer token issued by the identity service.
 * Expected claims: {@code sub} user id, {@code name} display name, {@code roles} capability list.
 */
@Slf4j
@Component
public class JwtTokenParser {

    static final String NAME_CLAIM = "name";
    static final String ROLES_CLAIM = "roles";

    private final Key key;

    public JwtTokenParser(@Value("${security.jwt.secret}") String secret) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<ReviewActor> parse(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            Long userId = Long.valueOf(claims.getSubject());
            Collection<?> roles = claims.get(ROLES_CLAIM, Collection.class);
            if (roles == null) {
                roles = Collections.emptyList();
            }
            return Optional.of(new ReviewActor(
                    userId,
                    claims.get(NAME_CLAIM, String.class),
                    roles.contains(ReviewActor.ROLE_CUSTOMER),
                    roles.contains(ReviewActor.ROLE_ADMIN)));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
