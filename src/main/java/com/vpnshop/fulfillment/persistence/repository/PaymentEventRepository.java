package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.PaymentEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentEventRepository extends JpaRepository<PaymentEventEntity, String> {

    Optional<PaymentEventEntity> findByProviderAndProviderTransactionId(PaymentProviderType provider,
                                                                       String providerTransactionId);

    List<PaymentEventEntity> findByResolvedOrderId(String orderId);

    @Query("SELECT e.eventId FROM PaymentEventEntity e WHERE e.processed = false AND e.receivedAt < :cutoff "
            + "AND (e.nextAttemptAt IS NULL OR e.nextAttemptAt <= :now) ORDER BY e.attempts, e.receivedAt")
    List<String> findUnprocessedEventIds(@Param("cutoff") Instant cutoff,
                                         @Param("now") Instant now,
                                         Pageable pageable);
}
