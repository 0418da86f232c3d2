package com.vpnshop.fulfillment.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted health flag per configured host. A missing row means healthy.
 */
@Entity
@Table(name = "host_health")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostHealthEntity {

    @Id
    @Column(name = "host_id", nullable = false)
    private String hostId;

    @Column(name = "healthy", nullable = false)
    private boolean healthy;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "changed_at", nullable = false)
    private Instant changedAt;
}
