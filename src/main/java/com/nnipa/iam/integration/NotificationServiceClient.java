package com.nnipa.iam.integration;

import com.nnipa.iam.util.CorrelationIdFilter;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Client for the Notification Service.
 * Delivery failures are retried, then logged by the fallback; they never reach the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationServiceClient implements NotificationSender {

    static final String SEND_PATH = "/api/v1/notifications/send";

    private final RestTemplate restTemplate;

    @Value("${services.notification-service.url}")
    private String notificationServiceUrl;

    @Override
    @CircuitBreaker(name = "notification-service", fallbackMethod = "fallbackNotification")
    @Retry(name = "notification-service")
    public void send(String toAddress, String subject, String body) {
        log.info("Sending notification '{}' to: {}", subject, toAddress);

        Map<String, Object> notification = new HashMap<>();
        notification.put("channel", "EMAIL");
        notification.put("to", toAddress);
        notification.put("subject", subject);
        notification.put("body", body);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
        if (correlationId != null) {
            headers.set(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId);
        }

        restTemplate.postForEntity(notificationServiceUrl + SEND_PATH, new HttpEntity<>(notification, headers), Void.class);
        log.debug("Notification delivered to: {}", toAddress);
    }

    // Fallback for circuit breaker

    public void fallbackNotification(String toAddress, String subject, String body, Exception e) {
        log.error("Notification '{}' to {} could not be delivered: {}", subject, toAddress, e.getMessage());
    }
}
