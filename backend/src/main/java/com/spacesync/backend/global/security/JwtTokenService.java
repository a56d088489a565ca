package com.spacesync.backend.global.security;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads the tenant-bearing access tokens presented by operators and API clients.
 * Tokens are issued by the account service; {@link #issueAccessToken} exists for tooling.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_TENANT_ID = "tenantId";
    static final String CLAIM_PLATFORM_ADMIN = "platformAdmin";
    static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public String issueAccessToken(UUID userId, UUID tenantId, boolean platformAdmin, List<String> roles) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_TENANT_ID, tenantId.toString())
                .claim(CLAIM_PLATFORM_ADMIN, platformAdmin)
                .claim(CLAIM_ROLES, roles)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public JwtAuthenticationPrincipal parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String tenantClaim = claims.get(CLAIM_TENANT_ID, String.class);
            if (tenantClaim == null) {
                throw new InvalidTokenException("Access token carries no tenant", null);
            }
            Boolean platformAdmin = claims.get(CLAIM_PLATFORM_ADMIN, Boolean.class);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();

            return new JwtAuthenticationPrincipal(
                    userId,
                    UUID.fromString(tenantClaim),
                    Boolean.TRUE.equals(platformAdmin),
                    roles
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
