package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProvisioningRecordRepository extends JpaRepository<ProvisioningRecordEntity, String> {

    Optional<ProvisioningRecordEntity> findByOrderId(String orderId);

    long countByOrderId(String orderId);

    @Query("SELECT r FROM ProvisioningRecordEntity r WHERE r.revoked = false AND r.expiresAt > :now "
            + "AND r.expiresAt <= :horizon ORDER BY r.expiresAt")
    List<ProvisioningRecordEntity> findExpiringBetween(@Param("now") Instant now,
                                                       @Param("horizon") Instant horizon,
                                                       Pageable pageable);

    @Query("SELECT r FROM ProvisioningRecordEntity r WHERE r.revoked = false AND r.expiresAt < :cutoff "
            + "AND (r.nextCleanupAt IS NULL OR r.nextCleanupAt <= :now) ORDER BY r.cleanupAttempts, r.expiresAt")
    List<ProvisioningRecordEntity> findExpiredBefore(@Param("cutoff") Instant cutoff,
                                                     @Param("now") Instant now,
                                                     Pageable pageable);
}
