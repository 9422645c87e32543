package com.nnipa.iam.security.jwt;

import lombok.Value;

import java.time.Instant;

/**
 * Signed access token and its expiry.
 */
@Value
public class IssuedToken {
    String token;
    Instant expiresAt;
}
