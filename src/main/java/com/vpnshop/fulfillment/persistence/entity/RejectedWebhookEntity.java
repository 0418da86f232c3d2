package com.vpnshop.fulfillment.persistence.entity;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only log of callbacks refused at the boundary. Never re-driven.
 */
@Entity
@Table(name = "rejected_webhooks", indexes = {
    @Index(name = "idx_rejected_received", columnList = "received_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedWebhookEntity {

    @Id
    @Column(name = "rejection_id", nullable = false, length = 36)
    private String rejectionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 16)
    private PaymentProviderType provider;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private Reason reason;

    @Column(name = "detail", length = 500)
    private String detail;

    @Column(name = "payload_hash", nullable = false, length = 64)
    private String payloadHash;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    public enum Reason {
        BAD_SIGNATURE, MALFORMED
    }
}
