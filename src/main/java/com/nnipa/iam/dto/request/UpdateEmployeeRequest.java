package com.nnipa.iam.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Profile fields change only when present; the role list always replaces the current roles.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Update employee request")
public class UpdateEmployeeRequest {

    @Size(max = 200, message = "Full name must not exceed 200 characters")
    @Schema(description = "Display name", example = "Carol Jones")
    private String fullName;

    @Size(max = 30, message = "Phone number must not exceed 30 characters")
    @Schema(description = "Phone number", example = "+15551234567")
    private String phoneNumber;

    @NotNull(message = "Roles are required")
    @Schema(description = "Complete set of role names", example = "[\"EMPLOYEE\", \"MANAGER\"]")
    private List<String> roles;
}
