package com.nnipa.iam.security;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Verified caller, built from access-token claims and passed explicitly to services.
 */
@Value
@Builder
public class CallerContext {
    UUID userId;
    String email;
    @Builder.Default
    List<String> roles = List.of();
}
