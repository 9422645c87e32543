package com.nnipa.iam.security.jwt;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.security.CallerContext;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies HMAC-SHA256 signed access tokens.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProvider {

    static final int MIN_SECRET_BYTES = 32;

    private final SecurityProperties securityProperties;
    private final Clock clock;

    private SecretKey signingKey;

    @PostConstruct
    public void init() {
        String secret = securityProperties.getJwt().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "security.jwt.secret must be configured with at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT signing key initialized for issuer {}", securityProperties.getJwt().getIssuer());
    }

    /**
     * Issue an access token for the identity's id, email, name and current roles.
     */
    public IssuedToken issueToken(Identity identity) {
        SecurityProperties.Jwt jwt = securityProperties.getJwt();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofMinutes(jwt.getAccessTokenLifetimeMinutes()));

        String token = Jwts.builder()
                .subject(identity.getId().toString())
                .issuer(jwt.getIssuer())
                .audience().add(jwt.getAudience()).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .id(UUID.randomUUID().toString())
                .claim("email", identity.getEmail())
                .claim("name", identity.getFullName())
                .claim("roles", identity.getRoleNames())
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();

        return new IssuedToken(token, expiresAt);
    }

    /**
     * Verify signature, issuer, audience and expiry and return the caller the token describes.
     */
    public Optional<CallerContext> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(securityProperties.getJwt().getIssuer())
                    .requireAudience(securityProperties.getJwt().getAudience())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            return Optional.of(CallerContext.builder()
                    .userId(UUID.fromString(claims.getSubject()))
                    .email(claims.get("email", String.class))
                    .roles(readRoles(claims))
                    .build());
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected access token: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private List<String> readRoles(Claims claims) {
        Object roles = claims.get("roles");
        if (!(roles instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .map(String::valueOf)
                .toList();
    }
}
