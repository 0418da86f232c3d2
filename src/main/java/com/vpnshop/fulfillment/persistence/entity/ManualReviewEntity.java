package com.vpnshop.fulfillment.persistence.entity;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ReviewReason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Operator queue item. Anything the pipeline refuses to guess about ends up here.
 */
@Entity
@Table(name = "manual_review_items", indexes = {
    @Index(name = "idx_review_status_created", columnList = "status, created_at"),
    @Index(name = "idx_review_order", columnList = "order_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_review_dedup_key", columnNames = "dedup_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReviewEntity {

    @Id
    @Column(name = "review_id", nullable = false, length = 36)
    private String reviewId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private ReviewReason reason;

    @Column(name = "dedup_key", nullable = false)
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", length = 16)
    private PaymentProviderType provider;

    @Column(name = "provider_transaction_id")
    private String providerTransactionId;

    @Column(name = "order_id", length = 36)
    private String orderId;

    @Column(name = "details", length = 2000)
    private String details;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private ReviewStatus status = ReviewStatus.OPEN;

    @Column(name = "resolution_note", length = 2000)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public enum ReviewStatus {
        OPEN, RESOLVED
    }
}
