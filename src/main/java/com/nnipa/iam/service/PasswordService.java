package com.nnipa.iam.service;

import com.nnipa.iam.dto.response.DispatchResponse;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Service for password change and reset operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordService {

    private final IdentityStore identityStore;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicyService passwordPolicyService;
    private final OneTimeCodeService oneTimeCodeService;
    private final AccountNotificationService accountNotificationService;
    private final AuditService auditService;

    /**
     * Change the caller's password. A second factor is not required again.
     */
    @Transactional
    public AuthOutcome<Void> changePassword(CallerContext caller, String currentPassword, String newPassword) {
        if (caller == null) {
            return AuthOutcome.failure(AuthErrorCode.UNAUTHENTICATED);
        }
        Identity identity = identityStore.findById(caller.getUserId())
                .filter(Identity::isActive)
                .orElse(null);
        if (identity == null) {
            return AuthOutcome.failure(AuthErrorCode.UNAUTHENTICATED);
        }

        if (currentPassword == null || !passwordEncoder.matches(currentPassword, identity.getPasswordHash())) {
            auditService.record(AuditEventType.PASSWORD_CHANGE, identity.getId(), identity.getId(), false,
                    "Wrong current password");
            return AuthOutcome.failure(AuthErrorCode.INVALID_CURRENT_PASSWORD);
        }
        if (newPassword != null && passwordEncoder.matches(newPassword, identity.getPasswordHash())) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR,
                    List.of("New password must be different from the current password"));
        }
        List<String> violations = passwordPolicyService.validate(newPassword, identity.getEmail());
        if (!violations.isEmpty()) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, violations);
        }

        identity.setPasswordHash(passwordEncoder.encode(newPassword));
        identityStore.update(identity);

        auditService.record(AuditEventType.PASSWORD_CHANGE, identity.getId(), identity.getId(), true, null);
        accountNotificationService.sendPasswordChangedNotice(identity.getEmail());
        log.info("Password changed for: {}", identity.getEmail());
        return AuthOutcome.success();
    }

    /**
     * Start a password reset. The answer never depends on the address.
     */
    public DispatchResponse forgotPassword(String email) {
        if (StringUtils.hasText(email)) {
            accountNotificationService.processPasswordResetRequest(email.trim());
        }
        return DispatchResponse.accepted();
    }

    /**
     * Replace the password using an emailed reset token.
     */
    @Transactional
    public AuthOutcome<Void> resetPassword(String email, String token, String newPassword) {
        List<String> violations = passwordPolicyService.validate(newPassword, email);
        if (!violations.isEmpty()) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, violations);
        }

        Identity identity = identityStore.findByEmail(email)
                .filter(Identity::isActive)
                .orElse(null);
        if (identity == null || !oneTimeCodeService.validate(identity.getId(), CodePurpose.PASSWORD_RESET, token)) {
            log.info("Password reset rejected for: {}", email);
            return AuthOutcome.failure(AuthErrorCode.INVALID_OR_EXPIRED_RESET_LINK);
        }

        identity.setPasswordHash(passwordEncoder.encode(newPassword));
        identity.setFailedAccessCount(0);
        identityStore.update(identity);

        auditService.record(AuditEventType.PASSWORD_RESET, identity.getId(), null, true, null);
        accountNotificationService.sendPasswordChangedNotice(identity.getEmail());
        log.info("Password reset completed for: {}", identity.getEmail());
        return AuthOutcome.success();
    }
}
