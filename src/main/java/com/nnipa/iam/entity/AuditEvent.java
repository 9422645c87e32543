package com.nnipa.iam.entity;

import com.nnipa.iam.enums.AuditEventType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Audit trail entry for authentication and administrative actions.
 */
@Entity
@Table(name = "audit_events", indexes = {
        @Index(name = "idx_audit_identity", columnList = "identity_id"),
        @Index(name = "idx_audit_occurred_at", columnList = "occurred_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "identity_id")
    private UUID identityId;

    @Column(name = "actor_id")
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50)
    private AuditEventType eventType;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "details", length = 1000)
    private String details;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;
}
