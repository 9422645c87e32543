package com.nnipa.iam.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Identity of a bank employee who can authenticate.
 *
 * Dynamic updates keep profile and role edits from overwriting the
 * failure counter and lockout columns, which the login path changes
 * through targeted update statements.
 */
@Entity
@Table(name = "identities", indexes = {
        @Index(name = "idx_identity_active", columnList = "active")
})
@DynamicUpdate
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Identity {

    /**
     * Lockout applied on deactivation; effectively never elapses.
     */
    public static final LocalDateTime PERMANENT_LOCKOUT = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "normalized_email", nullable = false, unique = true, length = 255)
    private String normalizedEmail;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "full_name", nullable = false, length = 200)
    private String fullName;

    @Column(name = "phone_number", length = 30)
    private String phoneNumber;

    @Column(name = "email_confirmed", nullable = false)
    @Builder.Default
    private boolean emailConfirmed = false;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "two_factor_enabled", nullable = false)
    @Builder.Default
    private boolean twoFactorEnabled = false;

    @Column(name = "lockout_until")
    private LocalDateTime lockoutUntil;

    @Column(name = "failed_access_count", nullable = false)
    @Builder.Default
    private int failedAccessCount = 0;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "identity_roles",
            joinColumns = @JoinColumn(name = "identity_id"),
            inverseJoinColumns = @JoinColumn(name = "role_id")
    )
    @BatchSize(size = 50)
    @Builder.Default
    private Set<Role> roles = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    // Helper methods
    public boolean isLockedOut(LocalDateTime now) {
        return lockoutUntil != null && lockoutUntil.isAfter(now);
    }

    public List<String> getRoleNames() {
        return roles.stream()
                .map(Role::getName)
                .sorted()
                .toList();
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
