package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.dto.response.LoginResponse;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.security.jwt.JwtTokenProvider;
import com.nnipa.iam.store.InMemoryIdentityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyString;

@ExtendWith(MockitoExtension.class)
class AuthenticationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
    private static final String PASSWORD = "P@ss1234";

    @Mock
    private OneTimeCodeService oneTimeCodeService;

    @Mock
    private AccountNotificationService accountNotificationService;

    @Mock
    private AuditService auditService;

    @Mock
    private RateLimitingService rateLimitingService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private InMemoryIdentityStore identityStore;
    private SecurityProperties properties;
    private AuthenticationService authenticationService;

    private Identity alice;
    private Identity bob;

    @BeforeEach
    void setUp() {
        identityStore = new InMemoryIdentityStore();
        properties = new SecurityProperties();
        properties.getJwt().setSecret("authentication-test-secret-0123456789abcdef");
        authenticationService = serviceAt(NOW);
        lenient().when(rateLimitingService.tryAcquireDispatch(anyString())).thenReturn(true);

        alice = employee("alice@bank.test", false);
        bob = employee("bob@bank.test", true);
    }

    private AuthenticationService serviceAt(Instant instant) {
        Clock clock = Clock.fixed(instant, ZoneOffset.UTC);
        JwtTokenProvider tokenProvider = new JwtTokenProvider(properties, clock);
        tokenProvider.init();
        AccountLockoutService lockoutService = new AccountLockoutService(identityStore, auditService, properties, clock);
        return new AuthenticationService(identityStore, passwordEncoder, tokenProvider, lockoutService,
                oneTimeCodeService, rateLimitingService, accountNotificationService, auditService, properties, clock);
    }

    private Identity employee(String email, boolean twoFactor) {
        return identityStore.create(Identity.builder()
                .email(email)
                .fullName(email.substring(0, email.indexOf('@')))
                .passwordHash(passwordEncoder.encode(PASSWORD))
                .emailConfirmed(true)
                .twoFactorEnabled(twoFactor)
                .roles(new HashSet<>(Set.of(identityStore.role("EMPLOYEE"))))
                .build());
    }

    @Test
    void loginWithoutTwoFactorIssuesToken() {
        AuthOutcome<LoginResponse> outcome = authenticationService.login("alice@bank.test", PASSWORD);

        assertThat(outcome.isSuccess()).isTrue();
        LoginResponse response = outcome.getValue();
        assertThat(response.isRequiresTwoFactor()).isFalse();
        assertThat(response.getAccessToken()).isNotBlank();
        assertThat(response.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(60)));
        assertThat(alice.getLastLoginAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 8, 0));
    }

    @Test
    void loginIgnoresEmailCase() {
        assertThat(authenticationService.login("  ALICE@Bank.Test ", PASSWORD).isSuccess()).isTrue();
    }

    @Test
    void loginWithTwoFactorReturnsChallengeWithoutToken() {
        when(oneTimeCodeService.issue(bob.getId(), CodePurpose.TWO_FACTOR)).thenReturn("123456");

        AuthOutcome<LoginResponse> outcome = authenticationService.login("bob@bank.test", PASSWORD);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue().isRequiresTwoFactor()).isTrue();
        assertThat(outcome.getValue().getUserId()).isEqualTo(bob.getId());
        assertThat(outcome.getValue().getAccessToken()).isNull();
        verify(accountNotificationService).sendTwoFactorCode("bob@bank.test", "123456");
    }

    @Test
    void verifyTwoFactorWithIssuedCodeIssuesToken() {
        when(oneTimeCodeService.validate(bob.getId(), CodePurpose.TWO_FACTOR, "123456")).thenReturn(true);

        AuthOutcome<LoginResponse> outcome = authenticationService.verifyTwoFactor(bob.getId(), "123456");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue().isRequiresTwoFactor()).isFalse();
        assertThat(outcome.getValue().getAccessToken()).isNotBlank();
        assertThat(bob.getLastLoginAt()).isNotNull();
    }

    @Test
    void verifyTwoFactorWithWrongCodeFails() {
        AuthOutcome<LoginResponse> outcome = authenticationService.verifyTwoFactor(bob.getId(), "000000");

        assertThat(outcome.getError()).isEqualTo(AuthErrorCode.INVALID_OR_EXPIRED_CODE);
        assertThat(bob.getFailedAccessCount()).isEqualTo(1);
    }

    @Test
    void consumedCodeCannotBeReplayed() {
        when(oneTimeCodeService.validate(bob.getId(), CodePurpose.TWO_FACTOR, "123456")).thenReturn(true, false);

        assertThat(authenticationService.verifyTwoFactor(bob.getId(), "123456").isSuccess()).isTrue();
        assertThat(authenticationService.verifyTwoFactor(bob.getId(), "123456").getError())
                .isEqualTo(AuthErrorCode.INVALID_OR_EXPIRED_CODE);
    }

    @Test
    void verifyTwoFactorRequiresTwoFactorToBeEnabled() {
        assertThat(authenticationService.verifyTwoFactor(alice.getId(), "123456").getError())
                .isEqualTo(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
        assertThat(authenticationService.verifyTwoFactor(UUID.randomUUID(), "123456").getError())
                .isEqualTo(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
        assertThat(authenticationService.verifyTwoFactor(null, "123456").getError())
                .isEqualTo(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
    }

    @Test
    void unknownEmailAndWrongPasswordAreIndistinguishable() {
        AuthOutcome<LoginResponse> unknown = authenticationService.login("nobody@bank.test", PASSWORD);
        AuthOutcome<LoginResponse> wrong = authenticationService.login("alice@bank.test", "Wr0ng!pass");

        assertThat(unknown.getError()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(wrong.getError()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(alice.getFailedAccessCount()).isEqualTo(1);
    }

    @Test
    void blankInputIsValidationError() {
        assertThat(authenticationService.login("", PASSWORD).getError()).isEqualTo(AuthErrorCode.VALIDATION_ERROR);
        assertThat(authenticationService.login("alice@bank.test", " ").getError())
                .isEqualTo(AuthErrorCode.VALIDATION_ERROR);
    }

    @Test
    void unconfirmedEmailIsReportedAsInvalidCredentials() {
        alice.setEmailConfirmed(false);

        assertThat(authenticationService.login("alice@bank.test", PASSWORD).getError())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    void unconfirmedEmailIsDisclosedWhenConfigured() {
        alice.setEmailConfirmed(false);
        properties.getLockout().setDiscloseAccountState(true);

        assertThat(authenticationService.login("alice@bank.test", PASSWORD).getError())
                .isEqualTo(AuthErrorCode.EMAIL_NOT_CONFIRMED);
    }

    @Test
    void deactivatedIdentityCannotLogIn() {
        alice.setActive(false);
        alice.setLockoutUntil(Identity.PERMANENT_LOCKOUT);

        assertThat(authenticationService.login("alice@bank.test", PASSWORD).getError())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        verify(oneTimeCodeService, never()).issue(alice.getId(), CodePurpose.TWO_FACTOR);
    }

    @Test
    void repeatedFailuresLockTheAccountUntilTheWindowElapses() {
        for (int i = 0; i < properties.getLockout().getMaxFailedAttempts(); i++) {
            assertThat(authenticationService.login("alice@bank.test", "Wr0ng!pass").getError())
                    .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        }

        assertThat(alice.getLockoutUntil()).isEqualTo(LocalDateTime.of(2026, 3, 2, 8, 15));
        assertThat(alice.getFailedAccessCount()).isZero();
        assertThat(authenticationService.login("alice@bank.test", PASSWORD).getError())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);

        properties.getLockout().setDiscloseAccountState(true);
        assertThat(authenticationService.login("alice@bank.test", PASSWORD).getError())
                .isEqualTo(AuthErrorCode.ACCOUNT_LOCKED);

        AuthenticationService later = serviceAt(NOW.plus(Duration.ofMinutes(16)));
        assertThat(later.login("alice@bank.test", PASSWORD).isSuccess()).isTrue();
    }

    @Test
    void wrongTwoFactorCodesShareTheLockoutCounter() {
        for (int i = 0; i < properties.getLockout().getMaxFailedAttempts(); i++) {
            authenticationService.verifyTwoFactor(bob.getId(), "000000");
        }

        assertThat(bob.isLockedOut(LocalDateTime.of(2026, 3, 2, 8, 0))).isTrue();
        assertThat(authenticationService.verifyTwoFactor(bob.getId(), "123456").getError())
                .isEqualTo(AuthErrorCode.INVALID_TWO_FACTOR_REQUEST);
    }

    @Test
    void wrongTwoFactorCodesAreNotCountedWhenDisabled() {
        properties.getLockout().setCountTwoFactorFailures(false);

        authenticationService.verifyTwoFactor(bob.getId(), "000000");

        assertThat(bob.getFailedAccessCount()).isZero();
    }

    @Test
    void successfulPasswordStepResetsFailureCounter() {
        when(oneTimeCodeService.issue(bob.getId(), CodePurpose.TWO_FACTOR)).thenReturn("654321");
        authenticationService.login("bob@bank.test", "Wr0ng!pass");
        assertThat(bob.getFailedAccessCount()).isEqualTo(1);

        authenticationService.login("bob@bank.test", PASSWORD);

        assertThat(bob.getFailedAccessCount()).isZero();
        verify(accountNotificationService).sendTwoFactorCode(anyString(), anyString());
    }

    @Test
    void throttledChallengeKeepsTheDeliveredCode() {
        when(rateLimitingService.tryAcquireDispatch("bob@bank.test")).thenReturn(false);

        AuthOutcome<LoginResponse> outcome = authenticationService.login("bob@bank.test", PASSWORD);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue().isRequiresTwoFactor()).isTrue();
        verify(oneTimeCodeService, never()).issue(bob.getId(), CodePurpose.TWO_FACTOR);
        verify(accountNotificationService, never()).sendTwoFactorCode(anyString(), anyString());
    }
}
