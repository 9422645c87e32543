package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.dto.response.LoginResponse;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.security.jwt.IssuedToken;
import com.nnipa.iam.security.jwt.JwtTokenProvider;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Password login followed, when enabled, by an emailed second factor.
 *
 * Unknown, inactive, unconfirmed and locked identities are reported exactly like a wrong
 * password unless account-state disclosure is switched on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

    private static final String DUMMY_PASSWORD = "timing-equalization-only";

    private final IdentityStore identityStore;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final AccountLockoutService accountLockoutService;
    private final OneTimeCodeService oneTimeCodeService;
    private final RateLimitingService rateLimitingService;
    private final AccountNotificationService accountNotificationService;
    private final AuditService auditService;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    private volatile String dummyHash;

    /**
     * Authenticate with email and password.
     */
    public AuthOutcome<LoginResponse> login(String email, String password) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR);
        }
        log.info("Login attempt for: {}", email);

        Optional<Identity> found = identityStore.findByEmail(email);
        if (found.isEmpty()) {
            passwordEncoder.matches(password, dummyHash());
            auditService.record(AuditEventType.LOGIN_FAILURE, null, null, false, "Unknown email");
            return AuthOutcome.failure(AuthErrorCode.INVALID_CREDENTIALS);
        }

        Identity identity = found.get();
        boolean disclose = securityProperties.getLockout().getDiscloseAccountState();

        if (!identity.isActive()) {
            return reject(identity, password, AuthErrorCode.INVALID_CREDENTIALS, "Inactive account");
        }
        if (!identity.isEmailConfirmed()) {
            return reject(identity, password,
                    disclose ? AuthErrorCode.EMAIL_NOT_CONFIRMED : AuthErrorCode.INVALID_CREDENTIALS,
                    "Email not confirmed");
        }
        if (accountLockoutService.isLockedOut(identity)) {
            return reject(identity, password,
                    disclose ? AuthErrorCode.ACCOUNT_LOCKED : AuthErrorCode.INVALID_CREDENTIALS,
                    "Account locked");
        }

        if (!passwordEncoder.matches(password, identity.getPasswordHash())) {
            accountLockoutService.recordFailedAttempt(identity);
            auditService.record(AuditEventType.LOGIN_FAILURE, identity.getId(), null, false, "Wrong password");
            log.info("Login failed for: {}", email);
            return AuthOutcome.failure(AuthErrorCode.INVALID_CREDENTIALS);
        }

        if (!identity.isTwoFactorEnabled()) {
            return AuthOutcome.success(completeLogin(identity, AuditEventType.LOGIN_SUCCESS));
        }

        accountLockoutService.resetFailedAttempts(identity);
        // a throttled login keeps the code that was already delivered
        if (rateLimitingService.tryAcquireDispatch(identity.getEmail())) {
            String code = oneTimeCodeService.issue(identity.getId(), CodePurpose.TWO_FACTOR);
            accountNotificationService.sendTwoFactorCode(identity.getEmail(), code);
        }
        auditService.record(AuditEventType.TWO_FACTOR_CHALLENGE, identity.getId(), null, true, null);
        log.info("Second factor required for: {}", email);

        return AuthOutcome.success(LoginResponse.twoFactorRequired(identity.getId()));
    }

    /**
     * Complete a login that is waiting for its second factor.
     */
    public AuthOutcome<LoginResponse> verifyTwoFactor(UUID userId, String code) {
        Identity identity = identityStore.findById(userId).orElse(null);
        if (identity == null || !identity.isActive() || !identity.isEmailConfirmed() || !identity.isTwoFactorEnabled()) {
            return AuthOutcome.failure(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
        }

        boolean countFailures = securityProperties.getLockout().getCountTwoFactorFailures();
        if (countFailures && accountLockoutService.isLockedOut(identity)) {
            auditService.record(AuditEventType.TWO_FACTOR_FAILURE, identity.getId(), null, false, "Account locked");
            return AuthOutcome.failure(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
        }

        if (!oneTimeCodeService.validate(identity.getId(), CodePurpose.TWO_FACTOR, code)) {
            if (countFailures) {
                accountLockoutService.recordFailedAttempt(identity);
            }
            auditService.record(AuditEventType.TWO_FACTOR_FAILURE, identity.getId(), null, false, "Invalid code");
            log.info("Second factor rejected for: {}", identity.getEmail());
            return AuthOutcome.failure(AuthErrorCode.INVALID_OR_EXPIRED_CODE);
        }

        return AuthOutcome.success(completeLogin(identity, AuditEventType.TWO_FACTOR_SUCCESS));
    }

    private LoginResponse completeLogin(Identity identity, AuditEventType eventType) {
        identityStore.recordSuccessfulLogin(identity.getId(), LocalDateTime.now(clock));
        IssuedToken token = jwtTokenProvider.issueToken(identity);
        auditService.record(eventType, identity.getId(), null, true, null);
        log.info("Login successful for: {}", identity.getEmail());
        return LoginResponse.authenticated(token);
    }

    private AuthOutcome<LoginResponse> reject(Identity identity, String password, AuthErrorCode error, String reason) {
        passwordEncoder.matches(password, dummyHash());
        auditService.record(AuditEventType.LOGIN_FAILURE, identity.getId(), null, false, reason);
        log.info("Login rejected for {}: {}", identity.getEmail(), reason);
        return AuthOutcome.failure(error);
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordEncoder.encode(DUMMY_PASSWORD);
            dummyHash = hash;
        }
        return hash;
    }
}
