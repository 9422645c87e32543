package com.nnipa.iam.dto.response;

import com.nnipa.iam.entity.Identity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Employee list entry")
public class EmployeeSummaryResponse {

    private UUID id;
    private String email;
    private String fullName;
    private boolean emailConfirmed;
    private boolean active;
    private boolean twoFactorEnabled;
    private List<String> roles;

    public static EmployeeSummaryResponse from(Identity identity) {
        return EmployeeSummaryResponse.builder()
                .id(identity.getId())
                .email(identity.getEmail())
                .fullName(identity.getFullName())
                .emailConfirmed(identity.isEmailConfirmed())
                .active(identity.isActive())
                .twoFactorEnabled(identity.isTwoFactorEnabled())
                .roles(identity.getRoleNames())
                .build();
    }
}
