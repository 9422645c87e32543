package com.nnipa.iam.dto.response;

import com.nnipa.iam.entity.Identity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Full employee detail for administrators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Employee detail")
public class EmployeeDetailResponse {

    private UUID id;
    private String email;
    private String fullName;
    private String phoneNumber;
    private boolean emailConfirmed;
    private boolean active;
    private boolean twoFactorEnabled;

    @Schema(description = "Whether a lockout is currently in effect")
    private boolean lockedOut;

    private LocalDateTime lockoutUntil;
    private int failedAccessCount;
    private LocalDateTime lastLoginAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<String> roles;

    public static EmployeeDetailResponse from(Identity identity, LocalDateTime now) {
        return EmployeeDetailResponse.builder()
                .id(identity.getId())
                .email(identity.getEmail())
                .fullName(identity.getFullName())
                .phoneNumber(identity.getPhoneNumber())
                .emailConfirmed(identity.isEmailConfirmed())
                .active(identity.isActive())
                .twoFactorEnabled(identity.isTwoFactorEnabled())
                .lockedOut(identity.isLockedOut(now))
                .lockoutUntil(identity.getLockoutUntil())
                .failedAccessCount(identity.getFailedAccessCount())
                .lastLoginAt(identity.getLastLoginAt())
                .createdAt(identity.getCreatedAt())
                .updatedAt(identity.getUpdatedAt())
                .roles(identity.getRoleNames())
                .build();
    }
}
