package com.nnipa.iam.store;

import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.entity.Role;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for identities and their role membership.
 *
 * Email lookups are case-insensitive. Failure counting and lockout transitions are
 * applied as single conditional updates so concurrent login attempts do not lose increments.
 */
public interface IdentityStore {

    Optional<Identity> findByEmail(String email);

    Optional<Identity> findById(UUID id);

    boolean existsByEmail(String email);

    Identity create(Identity identity);

    Identity update(Identity identity);

    void addRoles(Identity identity, Collection<Role> roles);

    void removeRoles(Identity identity, Collection<Role> roles);

    List<Role> findRolesByNames(Collection<String> names);

    /**
     * Case-insensitive search against email and full name. A blank search matches everything.
     */
    Page<Identity> search(String search, boolean includeInactive, Pageable pageable);

    /**
     * Increments the failure counter and returns its new value.
     */
    int recordFailedAccess(UUID id);

    /**
     * Locks the identity until {@code until} and resets its counter if the counter reached {@code threshold}.
     *
     * @return true when this call performed the lockout
     */
    boolean lockOutIfThresholdReached(UUID id, int threshold, LocalDateTime until);

    void resetFailedAccess(UUID id);

    void recordSuccessfulLogin(UUID id, LocalDateTime loginAt);
}
