package com.nnipa.iam;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Main application class for the bank IAM service.
 *
 * This service handles:
 * - Employee authentication with optional emailed second factor
 * - Signed access token issuance
 * - Password lifecycle (change, forgot, reset) and email confirmation
 * - Account lockout
 * - Administrative employee lifecycle (list, view, update, activate, deactivate)
 *
 * Integration points:
 * - Notification Service: delivery of one-time codes and links
 * - API Gateway: entry point for all requests
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
@EnableTransactionManagement
@ConfigurationPropertiesScan("com.nnipa.iam.config")
public class IamServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IamServiceApplication.class, args);
        log.info("===========================================");
        log.info("NNIPA Bank IAM Service Started");
        log.info("===========================================");
        log.info("Security Features:");
        log.info("- Password + emailed one-time code (2FA)");
        log.info("- JWT access tokens");
        log.info("- Account lockout on repeated failures");
        log.info("- Password reset and email confirmation links");
        log.info("===========================================");
    }

    /**
     * Password encoder bean using BCrypt algorithm.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }

    /**
     * RestTemplate for calls to the notification service.
     */
    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
