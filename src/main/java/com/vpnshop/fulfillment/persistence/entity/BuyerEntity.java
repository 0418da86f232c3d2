package com.vpnshop.fulfillment.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "buyers", indexes = {
    @Index(name = "idx_buyer_referrer", columnList = "referrer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyerEntity {

    /** Chat user id supplied by the bot. */
    @Id
    @Column(name = "buyer_id", nullable = false)
    private String buyerId;

    @Column(name = "referrer_id")
    private String referrerId;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;
}
