package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<OrderEntity> findByPaymentReference(String paymentReference);

    List<OrderEntity> findByBuyerIdOrderByCreatedAtDesc(String buyerId);

    /** Row lock for the duration of the caller's transaction; every state change goes through it. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.orderId = :orderId")
    Optional<OrderEntity> findByIdForUpdate(@Param("orderId") String orderId);

    @Query("SELECT o FROM OrderEntity o WHERE o.state = :state AND o.paymentProvider = :provider "
            + "AND o.quotedCurrency = :currency AND o.quotedAmount BETWEEN :minAmount AND :maxAmount "
            + "AND o.checkoutAt >= :since")
    List<OrderEntity> findPaymentCandidates(@Param("state") OrderState state,
                                            @Param("provider") PaymentProviderType provider,
                                            @Param("currency") String currency,
                                            @Param("minAmount") BigDecimal minAmount,
                                            @Param("maxAmount") BigDecimal maxAmount,
                                            @Param("since") Instant since);

    @Query("SELECT o FROM OrderEntity o WHERE o.buyerId = :buyerId AND o.hostId = :hostId "
            + "AND o.state IN :states ORDER BY o.createdAt DESC")
    List<OrderEntity> findOpenOrdersForBuyerOnHost(@Param("buyerId") String buyerId,
                                                   @Param("hostId") String hostId,
                                                   @Param("states") Collection<OrderState> states);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.state IN :states AND o.createdAt < :cutoff "
            + "ORDER BY o.createdAt")
    List<String> findStaleOrderIds(@Param("states") Collection<OrderState> states,
                                   @Param("cutoff") Instant cutoff,
                                   Pageable pageable);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.state IN :states AND o.provisioningDueAt <= :now "
            + "ORDER BY o.provisioningDueAt")
    List<String> findProvisioningDueOrderIds(@Param("states") Collection<OrderState> states,
                                             @Param("now") Instant now,
                                             Pageable pageable);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.state = :state AND o.settlementPending = true "
            + "ORDER BY o.fulfilledAt")
    List<String> findSettlementPendingOrderIds(@Param("state") OrderState state, Pageable pageable);

    /** Orders owing a notice whose backoff has passed; the least-failed come first. */
    @Query("SELECT o.orderId FROM OrderEntity o WHERE (o.notificationPending = true OR o.failureNotificationPending = true) "
            + "AND (o.nextNotificationAt IS NULL OR o.nextNotificationAt <= :now) "
            + "ORDER BY o.notificationAttempts, o.updatedAt")
    List<String> findNotificationPendingOrderIds(@Param("now") Instant now, Pageable pageable);

    long countByBuyerIdAndState(String buyerId, OrderState state);
}
