package com.vpnshop.fulfillment.persistence.entity;

import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One credit in a referrer's ledger. Uniqueness on (source order, kind) and on the
 * signup buyer keeps every rule at most once.
 */
@Entity
@Table(name = "referral_credits", indexes = {
    @Index(name = "idx_credit_referrer", columnList = "referrer_id, created_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_credit_order_kind", columnNames = {"source_order_id", "kind"}),
    @UniqueConstraint(name = "uk_credit_signup_buyer", columnNames = "signup_buyer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferralCreditEntity {

    @Id
    @Column(name = "credit_id", nullable = false, length = 36)
    private String creditId;

    @Column(name = "referrer_id", nullable = false)
    private String referrerId;

    @Column(name = "referred_buyer_id", nullable = false)
    private String referredBuyerId;

    @Column(name = "source_order_id", nullable = false, length = 36)
    private String sourceOrderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private ReferralCreditKind kind;

    /** Set only for {@link ReferralCreditKind#SIGNUP_BONUS}. */
    @Column(name = "signup_buyer_id")
    private String signupBuyerId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency_code", nullable = false, length = 8)
    private String currencyCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
