package com.nnipa.iam.repository;

import com.nnipa.iam.entity.Identity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Identity entity.
 * Counter and lockout columns are only changed through the update statements below.
 */
@Repository
public interface IdentityRepository extends JpaRepository<Identity, UUID> {

    @EntityGraph(attributePaths = "roles")
    Optional<Identity> findByNormalizedEmail(String normalizedEmail);

    @EntityGraph(attributePaths = "roles")
    Optional<Identity> findWithRolesById(UUID id);

    boolean existsByNormalizedEmail(String normalizedEmail);

    /**
     * Pattern is a LIKE pattern escaped with backslash.
     */
    @Query(value = "SELECT i FROM Identity i WHERE (:includeInactive = true OR i.active = true) " +
            "AND (i.normalizedEmail LIKE :pattern ESCAPE '\\' OR LOWER(i.fullName) LIKE :pattern ESCAPE '\\')",
            countQuery = "SELECT COUNT(i) FROM Identity i WHERE (:includeInactive = true OR i.active = true) " +
                    "AND (i.normalizedEmail LIKE :pattern ESCAPE '\\' OR LOWER(i.fullName) LIKE :pattern ESCAPE '\\')")
    Page<Identity> search(@Param("pattern") String pattern,
                          @Param("includeInactive") boolean includeInactive,
                          Pageable pageable);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Identity i SET i.failedAccessCount = i.failedAccessCount + 1 WHERE i.id = :id")
    int incrementFailedAccessCount(@Param("id") UUID id);

    @Query("SELECT i.failedAccessCount FROM Identity i WHERE i.id = :id")
    Optional<Integer> findFailedAccessCount(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Identity i SET i.lockoutUntil = :until, i.failedAccessCount = 0 " +
            "WHERE i.id = :id AND i.failedAccessCount >= :threshold")
    int lockOutIfThresholdReached(@Param("id") UUID id,
                                  @Param("threshold") int threshold,
                                  @Param("until") LocalDateTime until);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Identity i SET i.failedAccessCount = 0 WHERE i.id = :id")
    int resetFailedAccessCount(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Identity i SET i.failedAccessCount = 0, i.lastLoginAt = :loginAt WHERE i.id = :id")
    int recordSuccessfulLogin(@Param("id") UUID id, @Param("loginAt") LocalDateTime loginAt);
}
