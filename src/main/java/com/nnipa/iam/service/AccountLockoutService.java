package com.nnipa.iam.service;

import com.nnipa.iam.config.SecurityProperties;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service for managing account lockouts driven by the persisted failure counter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockoutService {

    private final IdentityStore identityStore;
    private final AuditService auditService;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    public boolean isLockedOut(Identity identity) {
        return identity.isLockedOut(LocalDateTime.now(clock));
    }

    /**
     * Count a failed attempt and lock the identity once the threshold is reached.
     *
     * @return true when this failure locked the identity
     */
    public boolean recordFailedAttempt(Identity identity) {
        SecurityProperties.Lockout lockout = securityProperties.getLockout();
        int attempts = identityStore.recordFailedAccess(identity.getId());
        log.debug("Failed attempt #{} for identity: {}", attempts, identity.getId());

        if (attempts < lockout.getMaxFailedAttempts()) {
            return false;
        }

        LocalDateTime until = LocalDateTime.now(clock).plusMinutes(lockout.getDurationMinutes());
        boolean locked = identityStore.lockOutIfThresholdReached(identity.getId(), lockout.getMaxFailedAttempts(), until);
        if (locked) {
            log.warn("Account locked until {} for: {}", until, identity.getEmail());
            auditService.record(AuditEventType.ACCOUNT_LOCKED, identity.getId(), null, true,
                    "Locked after " + attempts + " failed attempts");
        }
        return locked;
    }

    public void resetFailedAttempts(Identity identity) {
        identityStore.resetFailedAccess(identity.getId());
    }
}
