package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.AmountMismatchException;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.ConflictingPaymentException;
import com.vpnshop.fulfillment.domain.HostAuthFailedException;
import com.vpnshop.fulfillment.domain.HostUnavailableException;
import com.vpnshop.fulfillment.domain.IllegalStateTransitionException;
import com.vpnshop.fulfillment.domain.LatePaymentException;
import com.vpnshop.fulfillment.domain.OrderKind;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.messaging.OrderEventProducer;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.repository.BuyerRepository;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import io.github.resilience4j.core.IntervalFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives an order from creation to a terminal state. Each public operation is one
 * transaction holding the order's row lock, so a transition and the work it schedules
 * (provisioning due, settlement and notification pending) commit together. Remote
 * calls never happen in here; see {@link ProvisioningDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStateMachine {

    private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    private final OrderLedger ledger;
    private final FulfillmentProperties properties;
    private final HostRegistry hostRegistry;
    private final ManualReviewQueue reviewQueue;
    private final BuyerRepository buyerRepository;
    private final OrderEventProducer eventProducer;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public enum ConfirmationResult {
        CONFIRMED,
        ALREADY_CONFIRMED
    }

    public enum FailureOutcome {
        RETRY_SCHEDULED,
        FAILED,
        IGNORED
    }

    /**
     * Creates the order, or returns the one already created for the same buyer, plan and
     * nonce. A concurrent duplicate surfaces as a unique-key violation for the caller to
     * resolve by re-reading.
     */
    @Transactional
    public OrderEntity createOrder(CreateOrderCommand command) {
        String idempotencyKey = idempotencyKey(command);
        Optional<OrderEntity> existing = ledger.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Order already exists for idempotencyKey={}, orderId={}", idempotencyKey, existing.get().getOrderId());
            return existing.get();
        }

        FulfillmentProperties.Plan plan = properties.findPlan(command.getPlanId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan: " + command.getPlanId()));

        String hostId = command.getHostId();
        String renewalOf = null;
        OrderKind kind = OrderKind.NEW;
        if (command.getRenewalOfOrderId() != null) {
            OrderEntity renewed = ledger.getOrder(command.getRenewalOfOrderId());
            if (!renewed.getBuyerId().equals(command.getBuyerId())) {
                throw new IllegalArgumentException("Order " + renewed.getOrderId() + " belongs to another buyer");
            }
            String ownerId = OrderLedger.credentialOwnerId(renewed);
            ProvisioningRecordEntity record = ledger.findRecord(ownerId)
                    .filter(r -> !r.isRevoked())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Order " + renewed.getOrderId() + " has no live credential to renew"));
            hostId = record.getHostId();
            renewalOf = ownerId;
            kind = OrderKind.RENEWAL;
        }
        if (hostId == null || hostId.isBlank()) {
            throw new IllegalArgumentException("hostId is required for a new purchase");
        }
        hostRegistry.getHost(hostId);
        if (!hostRegistry.isHealthy(hostId)) {
            throw new HostUnavailableException("Host " + hostId + " is not accepting orders");
        }

        Instant now = clock.instant();
        OrderEntity order = OrderEntity.builder()
                .orderId(UUID.randomUUID().toString())
                .idempotencyKey(idempotencyKey)
                .buyerId(command.getBuyerId())
                .hostId(hostId)
                .planId(plan.getId())
                .planDays(plan.getDays())
                .price(priceFor(command.getBuyerId(), plan.getPrice()))
                .currencyCode(plan.getCurrency())
                .trafficLimitBytes(plan.getTrafficLimitGb() * BYTES_PER_GB)
                .kind(kind)
                .renewalOfOrderId(renewalOf)
                .state(OrderState.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        OrderEntity saved = ledger.insertOrder(order);
        log.info("Order created: orderId={}, buyerId={}, planId={}, hostId={}, kind={}, price={} {}",
                saved.getOrderId(), saved.getBuyerId(), saved.getPlanId(), saved.getHostId(), kind,
                saved.getPrice(), saved.getCurrencyCode());
        auditLogger.logTransition(saved.getOrderId(), null, OrderState.CREATED, "order created");
        eventProducer.publishTransition(saved, null, "created");
        return saved;
    }

    /**
     * Issues the payment reference the provider must echo back. Repeating the call keeps
     * the reference; choosing another provider only updates the quote.
     */
    @Transactional
    public OrderEntity awaitPayment(String orderId, PaymentProviderType provider,
                                    BigDecimal quotedAmount, String quotedCurrency) {
        OrderEntity order = ledger.lockOrder(orderId);
        if (order.getState() != OrderState.CREATED && order.getState() != OrderState.AWAITING_PAYMENT) {
            throw new IllegalStateTransitionException(orderId, order.getState(), OrderState.AWAITING_PAYMENT);
        }
        order.setPaymentProvider(provider);
        order.setQuotedAmount(quotedAmount != null ? quotedAmount : order.getPrice());
        order.setQuotedCurrency(quotedCurrency != null ? quotedCurrency : order.getCurrencyCode());
        order.setCheckoutAt(clock.instant());
        if (order.getState() == OrderState.AWAITING_PAYMENT) {
            order.setUpdatedAt(clock.instant());
            log.info("Checkout repeated: orderId={}, provider={}, reference={}", orderId, provider, order.getPaymentReference());
            return order;
        }
        order.setPaymentReference(newPaymentReference());
        OrderState previous = ledger.transition(order, OrderState.AWAITING_PAYMENT);
        auditLogger.logTransition(orderId, previous, OrderState.AWAITING_PAYMENT, "checkout " + provider);
        eventProducer.publishTransition(order, previous, "checkout " + provider);
        return order;
    }

    /**
     * Records a verified payment and schedules provisioning. The review item and flags
     * written on the rejection paths commit even though the call throws.
     */
    @Transactional(noRollbackFor = {AmountMismatchException.class, LatePaymentException.class,
            ConflictingPaymentException.class})
    public ConfirmationResult confirmPayment(String orderId, CanonicalPaymentEvent event) {
        OrderEntity order = ledger.lockOrder(orderId);
        OrderState state = order.getState();
        String txId = event.getProviderTransactionId();

        if (state.isPaid() && Objects.equals(order.getProviderTransactionId(), txId)
                && order.getPaymentProvider() == event.getProvider()) {
            log.info("Payment already recorded: orderId={}, provider={}, providerTxId={}, state={}",
                    orderId, event.getProvider(), txId, state);
            return ConfirmationResult.ALREADY_CONFIRMED;
        }

        // failed and refunded orders treat a new transaction as late
        if (state.isPaid() && state != OrderState.FAILED && state != OrderState.REFUNDED) {
            order.setReviewRequired(true);
            reviewQueue.open(ReviewReason.CONFLICTING_PAYMENT, reviewKey("conflict", event), event.getProvider(), txId,
                    orderId, "Order already paid by " + order.getPaymentProvider() + "/" + order.getProviderTransactionId()
                            + "; second payment " + event.getAmount() + " " + event.getCurrency());
            throw new ConflictingPaymentException(orderId, order.getProviderTransactionId(), txId);
        }

        if (!state.isAwaitingPayment()) {
            order.setReviewRequired(true);
            reviewQueue.open(ReviewReason.LATE_PAYMENT, reviewKey("late", event), event.getProvider(), txId,
                    orderId, "Payment " + event.getAmount() + " " + event.getCurrency() + " arrived in state " + state);
            throw new LatePaymentException(orderId, state);
        }

        if (isAmountMismatch(order, event)) {
            order.setReviewRequired(true);
            order.setUpdatedAt(clock.instant());
            reviewQueue.open(ReviewReason.AMOUNT_MISMATCH, reviewKey("mismatch", event), event.getProvider(), txId,
                    orderId, "Expected " + order.expectedAmount() + " " + order.expectedCurrency()
                            + ", received " + event.getAmount() + " " + event.getCurrency());
            log.warn("Amount mismatch: orderId={}, expected={} {}, received={} {}", orderId,
                    order.expectedAmount(), order.expectedCurrency(), event.getAmount(), event.getCurrency());
            throw new AmountMismatchException(orderId, order.expectedAmount(), order.expectedCurrency(),
                    event.getAmount(), event.getCurrency());
        }

        if (state == OrderState.CREATED) {
            ledger.transition(order, OrderState.AWAITING_PAYMENT);
        }

        Instant now = clock.instant();
        order.setPaymentProvider(event.getProvider());
        order.setProviderTransactionId(txId);
        order.setPaidAmount(event.getAmount());
        order.setPaidCurrency(event.getCurrency());
        order.setPaidAt(event.getPaidAt() != null ? event.getPaidAt() : now);
        order.setTargetExpiresAt(targetExpiry(order, now));
        order.setProvisioningAttempts(0);
        order.setProvisioningDueAt(now);
        OrderState previous = ledger.transition(order, OrderState.PAYMENT_CONFIRMED);

        auditLogger.logPaymentRecorded(orderId, event.getProvider(), txId, event.getAmount(), event.getCurrency());
        auditLogger.logTransition(orderId, previous, OrderState.PAYMENT_CONFIRMED, "payment " + txId);
        eventProducer.publishTransition(order, previous, "payment confirmed");
        return ConfirmationResult.CONFIRMED;
    }

    /**
     * Claims the next host call for the order. Pushes the due time one lease ahead so a
     * concurrent sweep skips the order while the call runs; a crashed call becomes due
     * again when the lease runs out.
     *
     * @return the request to send, or empty when nothing is due
     */
    @Transactional
    public Optional<ProvisioningRequest> beginProvisioningAttempt(String orderId) {
        OrderEntity order = ledger.lockOrder(orderId);
        OrderState state = order.getState();
        Instant now = clock.instant();
        if (state != OrderState.PAYMENT_CONFIRMED && state != OrderState.PROVISIONING) {
            return Optional.empty();
        }
        if (order.getProvisioningDueAt() == null || order.getProvisioningDueAt().isAfter(now)) {
            return Optional.empty();
        }
        FulfillmentProperties.Provisioning settings = properties.getProvisioning();
        if (state == OrderState.PROVISIONING && order.getProvisioningAttempts() >= settings.getMaxAttempts()) {
            log.warn("Provisioning lease expired with no attempts left: orderId={}, attempts={}",
                    orderId, order.getProvisioningAttempts());
            markFailed(order, "HOST_UNREACHABLE", "attempts exhausted");
            return Optional.empty();
        }
        if (state == OrderState.PAYMENT_CONFIRMED) {
            OrderState previous = ledger.transition(order, OrderState.PROVISIONING);
            auditLogger.logTransition(orderId, previous, OrderState.PROVISIONING, "provisioning started");
            eventProducer.publishTransition(order, previous, "provisioning");
        }
        order.setProvisioningAttempts(order.getProvisioningAttempts() + 1);
        order.setProvisioningDueAt(now.plus(settings.getCallLease()));
        order.setUpdatedAt(now);

        OrderEntity owner = order.getRenewalOfOrderId() != null ? ledger.getOrder(order.getRenewalOfOrderId()) : order;
        return Optional.of(ProvisioningRequest.builder()
                .orderId(orderId)
                .hostId(order.getHostId())
                .buyerId(order.getBuyerId())
                .clientReference(clientReference(owner))
                .clientUuid(clientUuid(owner))
                .expiresAt(order.getTargetExpiresAt())
                .trafficLimitBytes(order.getTrafficLimitBytes())
                .renewal(order.getKind() == OrderKind.RENEWAL)
                .build());
    }

    /**
     * Stores the credential and fulfills the order, queueing settlement and the buyer
     * notification in the same commit.
     *
     * @return false when the order was no longer provisioning and the result was dropped
     */
    @Transactional
    public boolean completeProvisioning(String orderId, ProvisioningResult result) {
        OrderEntity order = ledger.lockOrder(orderId);
        if (order.getState() != OrderState.PROVISIONING) {
            log.warn("Dropping provisioning result for orderId={} in state={}", orderId, order.getState());
            return false;
        }
        Instant now = clock.instant();
        if (order.getKind() == OrderKind.RENEWAL) {
            ProvisioningRecordEntity record = ledger.findRecord(order.getRenewalOfOrderId())
                    .orElseThrow(() -> new IllegalStateException("Renewed order has no record: " + order.getRenewalOfOrderId()));
            if (record.isRevoked()) {
                log.warn("Renewal of orderId={} reissued revoked credential recordId={} (revoked {} for {})",
                        orderId, record.getRecordId(), record.getRevokedAt(), record.getRevokeReason());
                record.setRevoked(false);
                record.setRevokedAt(null);
                record.setRevokeReason(null);
                record.setIssuedAt(now);
            }
            record.setCleanupAttempts(0);
            record.setNextCleanupAt(null);
            record.setExpiresAt(result.getExpiresAt());
            record.setLastRenewalAt(now);
            record.setRemoteCredentialId(result.getRemoteCredentialId());
            if (result.getSubscriptionLink() != null) {
                record.setSubscriptionLink(result.getSubscriptionLink());
            }
            record.setLastReminderHours(null);
            ledger.saveRecord(record);
        } else {
            ledger.saveRecord(ProvisioningRecordEntity.builder()
                    .recordId(UUID.randomUUID().toString())
                    .orderId(orderId)
                    .buyerId(order.getBuyerId())
                    .hostId(result.getHostId())
                    .remoteCredentialId(result.getRemoteCredentialId())
                    .clientReference(result.getClientReference())
                    .subscriptionLink(result.getSubscriptionLink())
                    .issuedAt(now)
                    .expiresAt(result.getExpiresAt())
                    .build());
        }
        order.setLastProvisioningError(null);
        order.setProvisioningDueAt(null);
        order.setFulfilledAt(now);
        order.setSettlementPending(true);
        order.setNotificationPending(true);
        OrderState previous = ledger.transition(order, OrderState.FULFILLED);
        auditLogger.logCredentialIssued(orderId, result);
        auditLogger.logTransition(orderId, previous, OrderState.FULFILLED, "credential issued");
        eventProducer.publishTransition(order, previous, "fulfilled");
        return true;
    }

    /**
     * Schedules the next attempt with exponential backoff, or fails the order when the
     * error is not retryable or the attempt budget is spent.
     */
    @Transactional
    public FailureOutcome failProvisioningAttempt(String orderId, ProvisioningException error) {
        OrderEntity order = ledger.lockOrder(orderId);
        if (order.getState() != OrderState.PROVISIONING) {
            log.warn("Ignoring provisioning failure for orderId={} in state={}", orderId, order.getState());
            return FailureOutcome.IGNORED;
        }
        Instant now = clock.instant();
        order.setLastProvisioningError(error.getErrorCode() + ": " + truncate(error.getMessage()));
        order.setUpdatedAt(now);

        if (error instanceof HostAuthFailedException) {
            hostRegistry.markUnhealthy(error.getHostId(), error.getMessage());
        }

        int attempts = order.getProvisioningAttempts();
        FulfillmentProperties.Provisioning settings = properties.getProvisioning();
        if (error.isRetryable() && attempts < settings.getMaxAttempts()) {
            Duration delay = Duration.ofMillis(backoff().apply(attempts));
            order.setProvisioningDueAt(now.plus(delay));
            log.warn("Provisioning attempt {} of {} failed for orderId={} ({}); next attempt in {}",
                    attempts, settings.getMaxAttempts(), orderId, error.getErrorCode(), delay);
            return FailureOutcome.RETRY_SCHEDULED;
        }
        markFailed(order, error.getErrorCode(), error.getMessage());
        return FailureOutcome.FAILED;
    }

    /** Expires an unpaid order whose payment window has closed; false when it no longer applies. */
    @Transactional
    public boolean expire(String orderId) {
        OrderEntity order = ledger.lockOrder(orderId);
        if (!order.getState().isAwaitingPayment()) {
            return false;
        }
        Instant cutoff = clock.instant().minus(properties.getOrders().getPaymentTimeout());
        if (order.getCreatedAt().isAfter(cutoff)) {
            return false;
        }
        OrderState previous = ledger.transition(order, OrderState.EXPIRED);
        auditLogger.logTransition(orderId, previous, OrderState.EXPIRED, "payment timeout");
        eventProducer.publishTransition(order, previous, "expired");
        return true;
    }

    /**
     * Operator refund of a fulfilled order. Marks the credential record revoked and returns
     * it so the caller can remove the credential from the host.
     */
    @Transactional
    public Optional<ProvisioningRecordEntity> refund(String orderId, String note) {
        OrderEntity order = ledger.lockOrder(orderId);
        OrderState previous = ledger.transition(order, OrderState.REFUNDED);
        order.setRefundEligible(false);
        order.setSettlementPending(false);
        order.setNotificationPending(false);

        Optional<ProvisioningRecordEntity> record = ledger.findRecord(OrderLedger.credentialOwnerId(order))
                .filter(r -> !r.isRevoked());
        record.ifPresent(r -> {
            r.setRevoked(true);
            r.setRevokedAt(clock.instant());
            r.setRevokeReason("REFUNDED");
            ledger.saveRecord(r);
        });
        auditLogger.logTransition(orderId, previous, OrderState.REFUNDED, note);
        eventProducer.publishTransition(order, previous, "refunded: " + note);
        return record;
    }

    private void markFailed(OrderEntity order, String errorCode, String message) {
        String orderId = order.getOrderId();
        order.setProvisioningDueAt(null);
        order.setRefundEligible(true);
        order.setReviewRequired(true);
        order.setFailureNotificationPending(true);
        OrderState previous = ledger.transition(order, OrderState.FAILED);
        reviewQueue.open(ReviewReason.PROVISIONING_FAILED, "provisioning:" + orderId, order.getPaymentProvider(),
                order.getProviderTransactionId(), orderId,
                "Provisioning failed on host " + order.getHostId() + " after " + order.getProvisioningAttempts()
                        + " attempt(s): " + errorCode + " " + message + "; refund eligible");
        log.error("Provisioning failed permanently: orderId={}, hostId={}, attempts={}, error={}",
                orderId, order.getHostId(), order.getProvisioningAttempts(), errorCode);
        auditLogger.logTransition(orderId, previous, OrderState.FAILED, errorCode);
        eventProducer.publishTransition(order, previous, "failed: " + errorCode);
    }

    private boolean isAmountMismatch(OrderEntity order, CanonicalPaymentEvent event) {
        BigDecimal received = event.getAmount();
        if (received == null || event.getCurrency() == null
                || !event.getCurrency().equalsIgnoreCase(order.expectedCurrency())) {
            return true;
        }
        BigDecimal expected = order.expectedAmount();
        BigDecimal tolerance = properties.getOrders().getAmountTolerance();
        if (received.compareTo(expected.subtract(tolerance)) < 0) {
            return true;
        }
        return !properties.getOrders().isAcceptOverpayment() && received.compareTo(expected.add(tolerance)) > 0;
    }

    private Instant targetExpiry(OrderEntity order, Instant now) {
        Duration term = Duration.ofDays(order.getPlanDays());
        if (order.getKind() != OrderKind.RENEWAL) {
            return now.plus(term);
        }
        Instant current = ledger.findRecord(order.getRenewalOfOrderId())
                .map(ProvisioningRecordEntity::getExpiresAt)
                .orElse(now);
        return (current.isAfter(now) ? current : now).plus(term);
    }

    private BigDecimal priceFor(String buyerId, BigDecimal planPrice) {
        BigDecimal discount = properties.getReferral().getReferredDiscountPercent();
        if (discount == null || discount.signum() <= 0) {
            return planPrice;
        }
        boolean referred = buyerRepository.findById(buyerId).map(b -> b.getReferrerId() != null).orElse(false);
        if (!referred) {
            return planPrice;
        }
        BigDecimal factor = BigDecimal.valueOf(100).subtract(discount).max(BigDecimal.ZERO);
        return planPrice.multiply(factor).divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }

    private IntervalFunction backoff() {
        FulfillmentProperties.Provisioning settings = properties.getProvisioning();
        return IntervalFunction.ofExponentialBackoff(settings.getInitialBackoff().toMillis(),
                settings.getBackoffMultiplier(), settings.getMaxBackoff().toMillis());
    }

    static String idempotencyKey(CreateOrderCommand command) {
        return WebhookSignatures.sha256Hex(command.getBuyerId() + ":" + command.getPlanId() + ":" + command.getNonce());
    }

    static String clientReference(OrderEntity owner) {
        return "o-" + owner.getIdempotencyKey().substring(0, 20) + "@" + owner.getHostId();
    }

    static String clientUuid(OrderEntity owner) {
        return UUID.nameUUIDFromBytes(owner.getIdempotencyKey().getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String newPaymentReference() {
        return "pr-" + UUID.randomUUID().toString().replace("-", "");
    }

    private static String reviewKey(String kind, CanonicalPaymentEvent event) {
        return kind + ":" + event.getProvider() + ":" + event.getProviderTransactionId();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > 900 ? message.substring(0, 900) : message;
    }
}
