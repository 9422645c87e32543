package com.nnipa.iam.dto.response;

import com.nnipa.iam.security.jwt.IssuedToken;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of a login or second-factor verification. Absent fields are serialized as null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login result")
public class LoginResponse {

    @Schema(description = "Whether a second factor must be verified before a token is issued", example = "false")
    private boolean requiresTwoFactor;

    @Schema(description = "User ID to pass to the second-factor verification")
    private UUID userId;

    @Schema(description = "Signed access token")
    private String accessToken;

    @Schema(description = "Access token expiry")
    private Instant expiresAt;

    public static LoginResponse authenticated(IssuedToken token) {
        return LoginResponse.builder()
                .requiresTwoFactor(false)
                .accessToken(token.getToken())
                .expiresAt(token.getExpiresAt())
                .build();
    }

    public static LoginResponse twoFactorRequired(UUID userId) {
        return LoginResponse.builder()
                .requiresTwoFactor(true)
                .userId(userId)
                .build();
    }
}
