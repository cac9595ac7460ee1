package com.market.chat.service;

import com.market.chat.domain.ChatIdentity;
import com.market.chat.domain.ChatRole;
import com.market.chat.exception.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Verifies the JWTs issued by the marketplace auth service.
 *
 * The subject is the user id and the {@code role} claim one of
 * customer, vendor or admin. Tokens are only consumed here, never issued,
 * except through {@link #generateToken} for local development and tests.
 */
@Service
@Slf4j
public class TokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_CLAIM = "role";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public TokenAuthenticator(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("security.jwt.secret must be set");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Resolve the caller's identity from a raw or {@code Bearer}-prefixed token.
     *
     * @throws UnauthenticatedException when the token is absent, invalid, expired
     *                                  or lacks a usable subject/role
     */
    public ChatIdentity authenticate(String token) {
        if (token == null || token.isBlank()) {
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Authentication required");
        }
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length());
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token.trim())
                .getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT for subject {}", e.getClaims().getSubject());
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected JWT: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Invalid token", e);
        }

        String userId = claims.getSubject();
        ChatRole role = ChatRole.fromClaim(claims.get(ROLE_CLAIM, String.class)).orElse(null);
        if (userId == null || userId.isBlank() || role == null) {
            log.warn("JWT without usable subject/role: subject={}", userId);
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Invalid token");
        }

        metricsService.recordAuthenticationAttempt(true);
        return ChatIdentity.of(userId, role);
    }

    /**
     * Issue a token (development and tests only).
     */
    public String generateToken(String userId, ChatRole role) {
        return Jwts.builder()
            .subject(userId)
            .claim(ROLE_CLAIM, role.wireName())
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
