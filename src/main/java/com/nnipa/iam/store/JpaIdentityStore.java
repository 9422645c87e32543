package com.nnipa.iam.store;

import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.entity.Role;
import com.nnipa.iam.repository.IdentityRepository;
import com.nnipa.iam.repository.RoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity store backed by Spring Data JPA.
 */
@Slf4j
@Component
@Transactional
@RequiredArgsConstructor
public class JpaIdentityStore implements IdentityStore {

    private final IdentityRepository identityRepository;
    private final RoleRepository roleRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return Optional.empty();
        }
        return identityRepository.findByNormalizedEmail(Identity.normalizeEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return identityRepository.findWithRolesById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return StringUtils.hasText(email)
                && identityRepository.existsByNormalizedEmail(Identity.normalizeEmail(email));
    }

    @Override
    public Identity create(Identity identity) {
        identity.setNormalizedEmail(Identity.normalizeEmail(identity.getEmail()));
        Identity saved = identityRepository.saveAndFlush(identity);
        log.debug("Created identity: {}", saved.getId());
        return saved;
    }

    @Override
    public Identity update(Identity identity) {
        return identityRepository.save(identity);
    }

    @Override
    public void addRoles(Identity identity, Collection<Role> roles) {
        if (roles.isEmpty()) {
            return;
        }
        identity.getRoles().addAll(roles);
        identityRepository.save(identity);
    }

    @Override
    public void removeRoles(Identity identity, Collection<Role> roles) {
        if (roles.isEmpty()) {
            return;
        }
        identity.getRoles().removeAll(roles);
        identityRepository.save(identity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Role> findRolesByNames(Collection<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        return roleRepository.findByNameIn(names);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Identity> search(String search, boolean includeInactive, Pageable pageable) {
        String pattern = StringUtils.hasText(search)
                ? "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%"
                : "%";
        return identityRepository.search(pattern, includeInactive, pageable);
    }

    @Override
    public int recordFailedAccess(UUID id) {
        identityRepository.incrementFailedAccessCount(id);
        return identityRepository.findFailedAccessCount(id).orElse(0);
    }

    @Override
    public boolean lockOutIfThresholdReached(UUID id, int threshold, LocalDateTime until) {
        return identityRepository.lockOutIfThresholdReached(id, threshold, until) == 1;
    }

    @Override
    public void resetFailedAccess(UUID id) {
        identityRepository.resetFailedAccessCount(id);
    }

    @Override
    public void recordSuccessfulLogin(UUID id, LocalDateTime loginAt) {
        identityRepository.recordSuccessfulLogin(id, loginAt);
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
