package com.vpnshop.fulfillment.persistence.service;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.IllegalStateTransitionException;
import com.vpnshop.fulfillment.domain.OrderNotFoundException;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.repository.OrderRepository;
import com.vpnshop.fulfillment.persistence.repository.ProvisioningRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of orders and their provisioning records. Every mutation goes through a
 * row-locked order loaded with {@link #lockOrder(String)} inside the caller's transaction,
 * and every state change through {@link #transition(OrderEntity, OrderState)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLedger {

    private static final EnumSet<OrderState> UNPAID = EnumSet.of(OrderState.CREATED, OrderState.AWAITING_PAYMENT);
    private static final EnumSet<OrderState> PROVISIONABLE = EnumSet.of(OrderState.PAYMENT_CONFIRMED, OrderState.PROVISIONING);

    private final OrderRepository orderRepository;
    private final ProvisioningRecordRepository recordRepository;
    private final FulfillmentProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<OrderEntity> findOrder(String orderId) {
        return orderRepository.findById(orderId);
    }

    @Transactional(readOnly = true)
    public OrderEntity getOrder(String orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public Optional<OrderEntity> findByIdempotencyKey(String idempotencyKey) {
        return orderRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public Optional<OrderEntity> findByPaymentReference(String paymentReference) {
        return orderRepository.findByPaymentReference(paymentReference);
    }

    /**
     * Loads the order with a pessimistic write lock held until the caller's transaction ends.
     * Concurrent callers for the same order queue here; different orders never contend.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderEntity lockOrder(String orderId) {
        return orderRepository.findByIdForUpdate(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OrderEntity insertOrder(OrderEntity order) {
        return orderRepository.saveAndFlush(order);
    }

    /**
     * Moves a locked order forward. Rejects anything not in the transition table, which is
     * what keeps state monotonic.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderState transition(OrderEntity order, OrderState target) {
        OrderState from = order.getState();
        if (!from.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(order.getOrderId(), from, target);
        }
        Instant now = clock.instant();
        order.setState(target);
        order.setUpdatedAt(now);
        if (target.isTerminal()) {
            order.setClosedAt(now);
        }
        log.info("Order transition: orderId={}, {} -> {}", order.getOrderId(), from, target);
        return from;
    }

    @Transactional(readOnly = true)
    public Optional<ProvisioningRecordEntity> findRecord(String orderId) {
        return recordRepository.findByOrderId(orderId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ProvisioningRecordEntity saveRecord(ProvisioningRecordEntity record) {
        return recordRepository.save(record);
    }

    /** Order that owns the credential: the renewed order for renewals, the order itself otherwise. */
    public static String credentialOwnerId(OrderEntity order) {
        return order.getRenewalOfOrderId() != null ? order.getRenewalOfOrderId() : order.getOrderId();
    }

    @Transactional
    public void clearNotificationPending(String orderId) {
        OrderEntity order = lockOrder(orderId);
        order.setNotificationPending(false);
        order.setUpdatedAt(clock.instant());
    }

    @Transactional
    public void clearFailureNotificationPending(String orderId) {
        OrderEntity order = lockOrder(orderId);
        order.setFailureNotificationPending(false);
        order.setUpdatedAt(clock.instant());
    }

    /**
     * Counts a failed sweep delivery and backs the order off.
     *
     * @return failed sweep deliveries so far
     */
    @Transactional
    public int recordNotificationFailure(String orderId) {
        OrderEntity order = lockOrder(orderId);
        int failures = order.getNotificationAttempts() + 1;
        order.setNotificationAttempts(failures);
        order.setNextNotificationAt(clock.instant().plus(properties.getSweeps().retryDelay(failures)));
        return failures;
    }

    /** Takes an undeliverable order out of the notification sweep. */
    @Transactional
    public void abandonNotifications(String orderId) {
        OrderEntity order = lockOrder(orderId);
        order.setNotificationPending(false);
        order.setFailureNotificationPending(false);
        order.setNextNotificationAt(null);
        order.setUpdatedAt(clock.instant());
    }

    @Transactional(readOnly = true)
    public List<String> findStaleUnpaidOrderIds(Instant createdBefore, int limit) {
        return orderRepository.findStaleOrderIds(UNPAID, createdBefore, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<String> findProvisioningDueOrderIds(int limit) {
        return orderRepository.findProvisioningDueOrderIds(PROVISIONABLE, clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<String> findSettlementPendingOrderIds(int limit) {
        return orderRepository.findSettlementPendingOrderIds(OrderState.FULFILLED, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<String> findNotificationPendingOrderIds(int limit) {
        return orderRepository.findNotificationPendingOrderIds(clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<ProvisioningRecordEntity> findRecordsExpiringBefore(Instant horizon, int limit) {
        return recordRepository.findExpiringBetween(clock.instant(), horizon, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<ProvisioningRecordEntity> findRecordsExpiredBefore(Instant cutoff, int limit) {
        return recordRepository.findExpiredBefore(cutoff, clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional
    public void markReminderSent(String recordId, int hoursMark) {
        recordRepository.findById(recordId).ifPresent(r -> r.setLastReminderHours(hoursMark));
    }

    /** Backs off an expired record whose host removal failed; returns the failures so far. */
    @Transactional
    public int deferCleanup(String recordId) {
        ProvisioningRecordEntity record = recordRepository.findById(recordId)
                .orElseThrow(() -> new IllegalStateException("Provisioning record vanished: " + recordId));
        int failures = record.getCleanupAttempts() + 1;
        record.setCleanupAttempts(failures);
        record.setNextCleanupAt(clock.instant().plus(properties.getSweeps().retryDelay(failures)));
        return failures;
    }

    @Transactional
    public void markRecordRevoked(String recordId, String reason) {
        recordRepository.findById(recordId).filter(r -> !r.isRevoked()).ifPresent(r -> {
            r.setRevoked(true);
            r.setRevokedAt(clock.instant());
            r.setRevokeReason(reason);
        });
    }
}
