package com.nnipa.iam.service;

import com.nnipa.iam.dto.response.DispatchResponse;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailVerificationService {

    private final IdentityStore identityStore;
    private final OneTimeCodeService oneTimeCodeService;
    private final AccountNotificationService accountNotificationService;
    private final AuditService auditService;

    /**
     * Confirm the identity's email address with the token from the confirmation link.
     */
    @Transactional
    public AuthOutcome<Void> confirmEmail(UUID userId, String token) {
        Identity identity = identityStore.findById(userId)
                .filter(Identity::isActive)
                .orElse(null);
        if (identity == null || !oneTimeCodeService.validate(identity.getId(), CodePurpose.EMAIL_CONFIRMATION, token)) {
            return AuthOutcome.failure(AuthErrorCode.INVALID_OR_EXPIRED_CODE);
        }

        if (!identity.isEmailConfirmed()) {
            identity.setEmailConfirmed(true);
            identityStore.update(identity);
            auditService.record(AuditEventType.EMAIL_CONFIRMED, identity.getId(), null, true, null);
            log.info("Email confirmed for: {}", identity.getEmail());
        }
        return AuthOutcome.success();
    }

    /**
     * Send a new confirmation link. The answer never depends on the address.
     */
    public DispatchResponse resendConfirmation(String email) {
        if (StringUtils.hasText(email)) {
            accountNotificationService.processConfirmationResend(email.trim());
        }
        return DispatchResponse.accepted();
    }
}
