package com.nnipa.iam.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Second-factor verification request")
public class TwoFactorVerificationRequest {

    @NotNull(message = "User ID is required")
    @Schema(description = "User ID returned by the login step")
    private UUID userId;

    @NotBlank(message = "Code is required")
    @Schema(description = "One-time code delivered by email", example = "123456")
    private String code;
}
