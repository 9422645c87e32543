package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.OneTimeCode;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.repository.OneTimeCodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Issues and redeems single-use codes scoped to an identity and a purpose.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OneTimeCodeService {

    private static final int LINK_TOKEN_BYTES = 32;

    private final OneTimeCodeRepository oneTimeCodeRepository;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Issue a fresh code, replacing any outstanding code for the same identity and purpose.
     *
     * @return the plain code; only its digest is persisted
     */
    @Transactional
    public String issue(UUID identityId, CodePurpose purpose) {
        LocalDateTime now = LocalDateTime.now(clock);
        String code = purpose == CodePurpose.TWO_FACTOR ? numericCode() : linkToken();

        int replaced = oneTimeCodeRepository.deleteOutstanding(identityId, purpose);
        oneTimeCodeRepository.save(OneTimeCode.builder()
                .identityId(identityId)
                .purpose(purpose)
                .codeHash(digest(code))
                .createdAt(now)
                .expiresAt(now.plus(lifetime(purpose)))
                .build());

        log.debug("Issued {} code for identity {} (replaced {})", purpose, identityId, replaced);
        return code;
    }

    /**
     * Redeem a code. Succeeds at most once per code, and only before it expires.
     */
    @Transactional
    public boolean validate(UUID identityId, CodePurpose purpose, String code) {
        if (identityId == null || code == null || code.isBlank()) {
            return false;
        }
        int redeemed = oneTimeCodeRepository.redeem(identityId, purpose, digest(code.trim()), LocalDateTime.now(clock));
        return redeemed == 1;
    }

    /**
     * Delete codes that expired or were used before the retention window.
     */
    @Transactional
    public int purgeStale() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(securityProperties.getCodes().getRetention());
        return oneTimeCodeRepository.deleteStale(cutoff);
    }

    Duration lifetime(CodePurpose purpose) {
        SecurityProperties.Codes codes = securityProperties.getCodes();
        return switch (purpose) {
            case TWO_FACTOR -> Duration.ofMinutes(codes.getTwoFactorLifetimeMinutes());
            case PASSWORD_RESET -> Duration.ofMinutes(codes.getPasswordResetLifetimeMinutes());
            case EMAIL_CONFIRMATION -> Duration.ofMinutes(codes.getEmailConfirmationLifetimeMinutes());
        };
    }

    private String numericCode() {
        int digits = securityProperties.getCodes().getTwoFactorDigits();
        StringBuilder code = new StringBuilder(digits);
        for (int i = 0; i < digits; i++) {
            code.append(secureRandom.nextInt(10));
        }
        return code.toString();
    }

    private String linkToken() {
        byte[] bytes = new byte[LINK_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String digest(String code) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(code.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
