package com.vpnshop.fulfillment.persistence.entity;

import com.vpnshop.fulfillment.domain.OrderKind;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One purchase intent. The single source of truth for the order lifecycle; rows are
 * never deleted, only moved to a terminal state.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_order_buyer", columnList = "buyer_id"),
    @Index(name = "idx_order_state_created", columnList = "state, created_at"),
    @Index(name = "idx_order_provisioning_due", columnList = "state, provisioning_due_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_order_idempotency_key", columnNames = "idempotency_key"),
    @UniqueConstraint(name = "uk_order_payment_reference", columnNames = "payment_reference")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(name = "buyer_id", nullable = false)
    private String buyerId;

    @Column(name = "host_id", nullable = false)
    private String hostId;

    @Column(name = "plan_id", nullable = false)
    private String planId;

    @Column(name = "plan_days", nullable = false)
    private int planDays;

    @Column(name = "price", nullable = false, precision = 19, scale = 2)
    private BigDecimal price;

    @Column(name = "currency_code", nullable = false, length = 8)
    private String currencyCode;

    @Column(name = "traffic_limit_bytes")
    private long trafficLimitBytes;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private OrderKind kind;

    /** Order whose credential a renewal extends; null for new purchases. */
    @Column(name = "renewal_of_order_id", length = 36)
    private String renewalOfOrderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private OrderState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_provider", length = 16)
    private PaymentProviderType paymentProvider;

    @Column(name = "payment_reference", length = 64)
    private String paymentReference;

    /** Amount the provider was asked to collect; defaults to the plan price. */
    @Column(name = "quoted_amount", precision = 19, scale = 9)
    private BigDecimal quotedAmount;

    @Column(name = "quoted_currency", length = 8)
    private String quotedCurrency;

    @Column(name = "checkout_at")
    private Instant checkoutAt;

    @Column(name = "provider_transaction_id")
    private String providerTransactionId;

    @Column(name = "paid_amount", precision = 19, scale = 9)
    private BigDecimal paidAmount;

    @Column(name = "paid_currency", length = 8)
    private String paidCurrency;

    @Column(name = "paid_at")
    private Instant paidAt;

    /** Absolute credential expiry fixed at confirmation so every host call asks for the same thing. */
    @Column(name = "target_expires_at")
    private Instant targetExpiresAt;

    @Column(name = "provisioning_attempts", nullable = false)
    private int provisioningAttempts;

    @Column(name = "provisioning_due_at")
    private Instant provisioningDueAt;

    @Column(name = "last_provisioning_error", length = 1000)
    private String lastProvisioningError;

    @Column(name = "settlement_pending", nullable = false)
    private boolean settlementPending;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "notification_pending", nullable = false)
    private boolean notificationPending;

    @Column(name = "failure_notification_pending", nullable = false)
    private boolean failureNotificationPending;

    /** Sweep deliveries of a pending notice that failed; the next one waits until nextNotificationAt. */
    @Column(name = "notification_attempts", nullable = false)
    private int notificationAttempts;

    @Column(name = "next_notification_at")
    private Instant nextNotificationAt;

    @Column(name = "refund_eligible", nullable = false)
    private boolean refundEligible;

    @Column(name = "review_required", nullable = false)
    private boolean reviewRequired;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /** Amount and currency the payment must match. */
    public BigDecimal expectedAmount() {
        return quotedAmount != null ? quotedAmount : price;
    }

    public String expectedCurrency() {
        return quotedCurrency != null ? quotedCurrency : currencyCode;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
