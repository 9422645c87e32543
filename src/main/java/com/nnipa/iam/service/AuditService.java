package com.nnipa.iam.service;

import com.nnipa.iam.entity.AuditEvent;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.repository.AuditEventRepository;
import com.nnipa.iam.util.CorrelationIdFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for the authentication and administration audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private static final int MAX_DETAILS_LENGTH = 1000;

    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    /**
     * Record an event about an identity. {@code actorId} is the administrator who acted, if any.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditEventType eventType, UUID identityId, UUID actorId, boolean success, String details) {
        log.debug("Audit event: {} for identity: {} (success={})", eventType, identityId, success);

        auditEventRepository.save(AuditEvent.builder()
                .identityId(identityId)
                .actorId(actorId)
                .eventType(eventType)
                .success(success)
                .details(truncate(details))
                .correlationId(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY))
                .occurredAt(LocalDateTime.now(clock))
                .build());
    }

    private static String truncate(String details) {
        if (details == null || details.length() <= MAX_DETAILS_LENGTH) {
            return details;
        }
        return details.substring(0, MAX_DETAILS_LENGTH);
    }
}
