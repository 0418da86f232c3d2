package com.vpnshop.fulfillment.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Credential issued on a host for a fulfilled order. Renewals extend the record of the
 * order they renew; revocation keeps the row for audit.
 */
@Entity
@Table(name = "provisioning_records", indexes = {
    @Index(name = "idx_record_expiry", columnList = "revoked, expires_at"),
    @Index(name = "idx_record_buyer", columnList = "buyer_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_record_order", columnNames = "order_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisioningRecordEntity {

    @Id
    @Column(name = "record_id", nullable = false, length = 36)
    private String recordId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "buyer_id", nullable = false)
    private String buyerId;

    @Column(name = "host_id", nullable = false)
    private String hostId;

    @Column(name = "remote_credential_id", nullable = false)
    private String remoteCredentialId;

    @Column(name = "client_reference", nullable = false)
    private String clientReference;

    @Column(name = "subscription_link", length = 1000)
    private String subscriptionLink;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "last_renewal_at")
    private Instant lastRenewalAt;

    /** Largest reminder mark (hours before expiry) already sent for the current expiry. */
    @Column(name = "last_reminder_hours")
    private Integer lastReminderHours;

    @Column(name = "revoked", nullable = false)
    private boolean revoked;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoke_reason", length = 200)
    private String revokeReason;

    /** Host removals that failed with a retryable error since the record expired. */
    @Column(name = "cleanup_attempts", nullable = false)
    private int cleanupAttempts;

    @Column(name = "next_cleanup_at")
    private Instant nextCleanupAt;
}
