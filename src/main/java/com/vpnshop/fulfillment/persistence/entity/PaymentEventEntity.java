package com.vpnshop.fulfillment.persistence.entity;

import com.vpnshop.fulfillment.domain.PaymentEventOutcome;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Durable record of one verified provider notification. The (provider, transaction id)
 * constraint is what makes repeated deliveries collapse into one row.
 */
@Entity
@Table(name = "payment_events", indexes = {
    @Index(name = "idx_event_processed_received", columnList = "processed, received_at"),
    @Index(name = "idx_event_order", columnList = "resolved_order_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_event_provider_tx", columnNames = {"provider", "provider_transaction_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 16)
    private PaymentProviderType provider;

    @Column(name = "provider_transaction_id", nullable = false)
    private String providerTransactionId;

    @Column(name = "amount", precision = 19, scale = 9)
    private BigDecimal amount;

    @Column(name = "currency_code", length = 8)
    private String currencyCode;

    @Column(name = "order_reference")
    private String orderReference;

    @Column(name = "resolved_order_id", length = 36)
    private String resolvedOrderId;

    @Column(name = "raw_payload", nullable = false, columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "payload_hash", nullable = false, length = 64)
    private String payloadHash;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 32)
    private PaymentEventOutcome outcome;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    /** Earliest time the re-drive sweep picks the event up again after a failed attempt. */
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}
