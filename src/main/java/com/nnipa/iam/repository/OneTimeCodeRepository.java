package com.nnipa.iam.repository;

import com.nnipa.iam.entity.OneTimeCode;
import com.nnipa.iam.enums.CodePurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface OneTimeCodeRepository extends JpaRepository<OneTimeCode, UUID> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OneTimeCode c WHERE c.identityId = :identityId AND c.purpose = :purpose AND c.usedAt IS NULL")
    int deleteOutstanding(@Param("identityId") UUID identityId, @Param("purpose") CodePurpose purpose);

    /**
     * Marks a matching, unexpired, unused code as used. Returns 1 when the code was redeemed, 0 otherwise.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE OneTimeCode c SET c.usedAt = :now " +
            "WHERE c.identityId = :identityId AND c.purpose = :purpose AND c.codeHash = :codeHash " +
            "AND c.usedAt IS NULL AND c.expiresAt > :now")
    int redeem(@Param("identityId") UUID identityId,
               @Param("purpose") CodePurpose purpose,
               @Param("codeHash") String codeHash,
               @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM OneTimeCode c WHERE c.expiresAt < :cutoff OR (c.usedAt IS NOT NULL AND c.usedAt < :cutoff)")
    int deleteStale(@Param("cutoff") LocalDateTime cutoff);
}
