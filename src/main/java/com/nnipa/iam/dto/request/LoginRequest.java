package com.nnipa.iam.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Login request DTO for email/password authentication.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login request with email and password")
public class LoginRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Email address", example = "alice@bank.test")
    private String email;

    @NotBlank(message = "Password is required")
    @Schema(description = "Password", example = "P@ss1234")
    private String password;
}
