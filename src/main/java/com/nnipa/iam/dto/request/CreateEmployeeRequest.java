package com.nnipa.iam.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Administrative creation of an employee identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create employee request")
public class CreateEmployeeRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    @Schema(description = "Email address", example = "carol@bank.test")
    private String email;

    @NotBlank(message = "Full name is required")
    @Size(max = 200, message = "Full name must not exceed 200 characters")
    @Schema(description = "Display name", example = "Carol Jones")
    private String fullName;

    @Size(max = 30, message = "Phone number must not exceed 30 characters")
    @Schema(description = "Phone number", example = "+15551234567")
    private String phoneNumber;

    @NotBlank(message = "Password is required")
    @Schema(description = "Initial password")
    private String password;

    @Schema(description = "Role names; defaults to EMPLOYEE when empty", example = "[\"EMPLOYEE\"]")
    @Builder.Default
    private List<String> roles = new ArrayList<>();
}
