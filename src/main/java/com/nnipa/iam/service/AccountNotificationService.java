package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.integration.NotificationSender;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;
import java.util.UUID;

/**
 * Composes account messages and delivers them off the request thread.
 *
 * Password reset and confirmation resend requests are resolved here as well, so the
 * HTTP response never depends on whether the address belongs to an eligible identity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountNotificationService {

    private final NotificationSender notificationSender;
    private final OneTimeCodeService oneTimeCodeService;
    private final RateLimitingService rateLimitingService;
    private final IdentityStore identityStore;
    private final SecurityProperties securityProperties;

    /**
     * Deliver an issued second-factor code. The caller has already counted the dispatch.
     */
    @Async
    public void sendTwoFactorCode(String email, String code) {
        int minutes = securityProperties.getCodes().getTwoFactorLifetimeMinutes();
        notificationSender.send(email, "Your sign-in verification code",
                "Your verification code is " + code + ". It expires in " + minutes + " minutes. "
                        + "If you did not try to sign in, contact the security team.");
    }

    @Async
    public void sendEmailConfirmation(UUID identityId, String email, String token) {
        deliverConfirmationLink(identityId, email, token);
    }

    @Async
    public void sendPasswordChangedNotice(String email) {
        notificationSender.send(email, "Your password was changed",
                "The password for your account was just changed. "
                        + "If you did not make this change, contact the security team immediately.");
    }

    /**
     * Issue and send a reset link if the address belongs to an active, confirmed identity.
     */
    @Async
    public void processPasswordResetRequest(String email) {
        Optional<Identity> identity = identityStore.findByEmail(email)
                .filter(Identity::isActive)
                .filter(Identity::isEmailConfirmed);
        if (identity.isEmpty()) {
            log.info("Password reset requested for ineligible address: {}", email);
            return;
        }
        if (!rateLimitingService.tryAcquireDispatch(email)) {
            return;
        }

        Identity target = identity.get();
        String token = oneTimeCodeService.issue(target.getId(), CodePurpose.PASSWORD_RESET);
        String link = UriComponentsBuilder.fromUriString(securityProperties.getLinks().getResetPasswordUrl())
                .queryParam("email", target.getEmail())
                .queryParam("token", token)
                .encode()
                .toUriString();
        int minutes = securityProperties.getCodes().getPasswordResetLifetimeMinutes();

        notificationSender.send(target.getEmail(), "Reset your password",
                "Use the following link to choose a new password: " + link
                        + " The link expires in " + minutes + " minutes and can be used once.");
        log.info("Password reset link dispatched to: {}", target.getEmail());
    }

    /**
     * Issue and send a new confirmation link if the address belongs to an active, unconfirmed identity.
     */
    @Async
    public void processConfirmationResend(String email) {
        Optional<Identity> identity = identityStore.findByEmail(email)
                .filter(Identity::isActive)
                .filter(candidate -> !candidate.isEmailConfirmed());
        if (identity.isEmpty()) {
            log.info("Confirmation resend requested for ineligible address: {}", email);
            return;
        }
        if (!rateLimitingService.tryAcquireDispatch(email)) {
            return;
        }

        Identity target = identity.get();
        String token = oneTimeCodeService.issue(target.getId(), CodePurpose.EMAIL_CONFIRMATION);
        deliverConfirmationLink(target.getId(), target.getEmail(), token);
    }

    private void deliverConfirmationLink(UUID identityId, String email, String token) {
        String link = UriComponentsBuilder.fromUriString(securityProperties.getLinks().getConfirmEmailUrl())
                .queryParam("userId", identityId)
                .queryParam("token", token)
                .encode()
                .toUriString();

        notificationSender.send(email, "Confirm your email address",
                "Confirm your email address by opening this link: " + link);
        log.info("Confirmation link dispatched to: {}", email);
    }
}
