package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.repository.OneTimeCodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class OneTimeCodeServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    @Autowired
    private OneTimeCodeRepository oneTimeCodeRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final SecurityProperties properties = new SecurityProperties();

    private UUID identityId;

    @BeforeEach
    void setUp() {
        Identity identity = entityManager.persistAndFlush(Identity.builder()
                .email("alice@bank.test")
                .normalizedEmail("alice@bank.test")
                .fullName("Alice Smith")
                .passwordHash("hash")
                .build());
        identityId = identity.getId();
    }

    private OneTimeCodeService serviceAt(Instant instant) {
        return new OneTimeCodeService(oneTimeCodeRepository, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void twoFactorCodesAreNumericAndLinkTokensAreUrlSafe() {
        OneTimeCodeService service = serviceAt(NOW);

        assertThat(service.issue(identityId, CodePurpose.TWO_FACTOR)).matches("\\d{6}");
        assertThat(service.issue(identityId, CodePurpose.PASSWORD_RESET)).matches("[A-Za-z0-9_-]{43}");
    }

    @Test
    void codeCanBeRedeemedOnlyOnce() {
        OneTimeCodeService service = serviceAt(NOW);
        String code = service.issue(identityId, CodePurpose.TWO_FACTOR);

        assertThat(service.validate(identityId, CodePurpose.TWO_FACTOR, code)).isTrue();
        assertThat(service.validate(identityId, CodePurpose.TWO_FACTOR, code)).isFalse();
    }

    @Test
    void expiredCodeIsRejected() {
        String code = serviceAt(NOW).issue(identityId, CodePurpose.TWO_FACTOR);

        OneTimeCodeService later = serviceAt(NOW.plus(Duration.ofMinutes(10)));
        assertThat(later.validate(identityId, CodePurpose.TWO_FACTOR, code)).isFalse();
    }

    @Test
    void codeIsScopedToItsPurposeAndIdentity() {
        OneTimeCodeService service = serviceAt(NOW);
        String token = service.issue(identityId, CodePurpose.EMAIL_CONFIRMATION);

        assertThat(service.validate(identityId, CodePurpose.PASSWORD_RESET, token)).isFalse();
        assertThat(service.validate(UUID.randomUUID(), CodePurpose.EMAIL_CONFIRMATION, token)).isFalse();
        assertThat(service.validate(identityId, CodePurpose.EMAIL_CONFIRMATION, token)).isTrue();
    }

    @Test
    void reissuingInvalidatesTheEarlierCode() {
        OneTimeCodeService service = serviceAt(NOW);
        String first = service.issue(identityId, CodePurpose.PASSWORD_RESET);
        String second = service.issue(identityId, CodePurpose.PASSWORD_RESET);

        assertThat(service.validate(identityId, CodePurpose.PASSWORD_RESET, first)).isFalse();
        assertThat(service.validate(identityId, CodePurpose.PASSWORD_RESET, second)).isTrue();
    }

    @Test
    void blankOrMissingInputIsRejected() {
        OneTimeCodeService service = serviceAt(NOW);

        assertThat(service.validate(identityId, CodePurpose.TWO_FACTOR, " ")).isFalse();
        assertThat(service.validate(null, CodePurpose.TWO_FACTOR, "123456")).isFalse();
    }

    @Test
    void purgeRemovesOnlyCodesPastRetention() {
        serviceAt(NOW).issue(identityId, CodePurpose.TWO_FACTOR);
        serviceAt(NOW).issue(identityId, CodePurpose.PASSWORD_RESET);
        entityManager.flush();

        // two-factor code expired at +10m, reset link at +60m; retention is one day
        int purged = serviceAt(NOW.plus(Duration.ofDays(1)).plus(Duration.ofMinutes(30))).purgeStale();

        assertThat(purged).isEqualTo(1);
        assertThat(oneTimeCodeRepository.count()).isEqualTo(1);
    }
}
