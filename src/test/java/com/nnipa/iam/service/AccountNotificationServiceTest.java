package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.integration.NotificationSender;
import com.nnipa.iam.store.InMemoryIdentityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountNotificationServiceTest {

    @Mock
    private NotificationSender notificationSender;

    @Mock
    private OneTimeCodeService oneTimeCodeService;

    @Mock
    private RateLimitingService rateLimitingService;

    private InMemoryIdentityStore identityStore;
    private AccountNotificationService accountNotificationService;

    @BeforeEach
    void setUp() {
        identityStore = new InMemoryIdentityStore();
        SecurityProperties properties = new SecurityProperties();
        properties.getLinks().setResetPasswordUrl("https://portal.bank.test/reset");
        properties.getLinks().setConfirmEmailUrl("https://portal.bank.test/confirm");
        accountNotificationService = new AccountNotificationService(notificationSender, oneTimeCodeService,
                rateLimitingService, identityStore, properties);
    }

    private Identity identity(String email, boolean active, boolean confirmed) {
        return identityStore.create(Identity.builder()
                .email(email)
                .fullName("Test User")
                .passwordHash("hash")
                .active(active)
                .emailConfirmed(confirmed)
                .build());
    }

    @Test
    void resetLinkCarriesEmailAndToken() {
        Identity alice = identity("alice@bank.test", true, true);
        when(rateLimitingService.tryAcquireDispatch("alice@bank.test")).thenReturn(true);
        when(oneTimeCodeService.issue(alice.getId(), CodePurpose.PASSWORD_RESET)).thenReturn("reset-token");

        accountNotificationService.processPasswordResetRequest("alice@bank.test");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationSender).send(eq("alice@bank.test"), anyString(), body.capture());
        assertThat(body.getValue())
                .contains("https://portal.bank.test/reset?email=alice@bank.test&token=reset-token");
    }

    @Test
    void resetIsSilentForUnknownInactiveOrUnconfirmedAddresses() {
        identity("inactive@bank.test", false, true);
        identity("unconfirmed@bank.test", true, false);

        accountNotificationService.processPasswordResetRequest("ghost@bank.test");
        accountNotificationService.processPasswordResetRequest("inactive@bank.test");
        accountNotificationService.processPasswordResetRequest("unconfirmed@bank.test");

        verifyNoInteractions(notificationSender, oneTimeCodeService, rateLimitingService);
    }

    @Test
    void throttledResetIssuesNoCode() {
        identity("alice@bank.test", true, true);
        when(rateLimitingService.tryAcquireDispatch("alice@bank.test")).thenReturn(false);

        accountNotificationService.processPasswordResetRequest("alice@bank.test");

        verifyNoInteractions(oneTimeCodeService, notificationSender);
    }

    @Test
    void confirmationResendOnlyForUnconfirmedIdentities() {
        Identity carol = identity("carol@bank.test", true, false);
        identity("alice@bank.test", true, true);
        when(rateLimitingService.tryAcquireDispatch("carol@bank.test")).thenReturn(true);
        when(oneTimeCodeService.issue(carol.getId(), CodePurpose.EMAIL_CONFIRMATION)).thenReturn("confirm-token");

        accountNotificationService.processConfirmationResend("carol@bank.test");
        accountNotificationService.processConfirmationResend("alice@bank.test");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationSender).send(eq("carol@bank.test"), anyString(), body.capture());
        assertThat(body.getValue()).contains("userId=" + carol.getId()).contains("token=confirm-token");
        verify(oneTimeCodeService, never()).issue(any(UUID.class), eq(CodePurpose.PASSWORD_RESET));
    }

    @Test
    void issuedTwoFactorCodeIsAlwaysDelivered() {
        accountNotificationService.sendTwoFactorCode("bob@bank.test", "654321");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationSender).send(eq("bob@bank.test"), anyString(), body.capture());
        assertThat(body.getValue()).contains("654321");
        verifyNoInteractions(rateLimitingService);
    }

    @Test
    void passwordChangedNoticeIsNotThrottled() {
        accountNotificationService.sendPasswordChangedNotice("alice@bank.test");

        verify(notificationSender).send(eq("alice@bank.test"), eq("Your password was changed"), anyString());
        verifyNoInteractions(rateLimitingService);
    }
}
