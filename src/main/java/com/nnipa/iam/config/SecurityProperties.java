package com.nnipa.iam.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Security configuration properties for the IAM service.
 */
@Data
@ConfigurationProperties(prefix = "security")
public class SecurityProperties {

    private Jwt jwt = new Jwt();
    private Lockout lockout = new Lockout();
    private Codes codes = new Codes();
    private Links links = new Links();
    private Throttle throttle = new Throttle();
    private Admin admin = new Admin();

    @Data
    public static class Jwt {
        private String secret;
        private String issuer = "https://iam.nnipa.bank";
        private String audience = "nnipa-bank-platform";
        private Integer accessTokenLifetimeMinutes = 60;
    }

    @Data
    public static class Lockout {
        private Integer maxFailedAttempts = 5;
        private Integer durationMinutes = 15;

        /**
         * Whether a wrong two-factor code counts against the same counter as a wrong password.
         */
        private Boolean countTwoFactorFailures = true;

        /**
         * Report ACCOUNT_LOCKED / EMAIL_NOT_CONFIRMED instead of INVALID_CREDENTIALS.
         */
        private Boolean discloseAccountState = false;
    }

    @Data
    public static class Codes {
        private Integer twoFactorLifetimeMinutes = 10;
        private Integer twoFactorDigits = 6;
        private Integer passwordResetLifetimeMinutes = 60;
        private Integer emailConfirmationLifetimeMinutes = 1440;
        private Duration retention = Duration.ofDays(1);
    }

    @Data
    public static class Links {
        private String confirmEmailUrl = "http://localhost:3000/auth/confirm-email";
        private String resetPasswordUrl = "http://localhost:3000/auth/reset-password";
    }

    @Data
    public static class Throttle {
        private Integer maxDispatches = 5;
        private Duration window = Duration.ofMinutes(15);
    }

    @Data
    public static class Admin {
        private List<String> readRoles = new ArrayList<>(List.of("ADMIN", "MANAGER"));
        private List<String> writeRoles = new ArrayList<>(List.of("ADMIN"));
    }
}
