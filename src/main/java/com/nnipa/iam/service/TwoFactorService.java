package com.nnipa.iam.service;

import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the emailed second factor on or off for the calling identity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwoFactorService {

    private final IdentityStore identityStore;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;

    @Transactional
    public AuthOutcome<Void> enable(CallerContext caller, String currentPassword) {
        return setEnabled(caller, currentPassword, true);
    }

    @Transactional
    public AuthOutcome<Void> disable(CallerContext caller, String currentPassword) {
        return setEnabled(caller, currentPassword, false);
    }

    private AuthOutcome<Void> setEnabled(CallerContext caller, String currentPassword, boolean enabled) {
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
            return AuthOutcome.failure(AuthErrorCode.INVALID_CURRENT_PASSWORD);
        }

        if (identity.isTwoFactorEnabled() != enabled) {
            identity.setTwoFactorEnabled(enabled);
            identityStore.update(identity);
            auditService.record(enabled ? AuditEventType.TWO_FACTOR_ENABLED : AuditEventType.TWO_FACTOR_DISABLED,
                    identity.getId(), identity.getId(), true, null);
            log.info("Two-factor authentication {} for: {}", enabled ? "enabled" : "disabled", identity.getEmail());
        }
        return AuthOutcome.success();
    }
}
