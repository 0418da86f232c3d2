package com.vpnshop.fulfillment.domain;

public enum ReferralCreditKind {
    /** Percentage of the paid amount of each referred purchase. */
    PERCENTAGE,
    /** Fixed amount per referred purchase. */
    FIXED_PER_PURCHASE,
    /** Fixed bonus, once per referred buyer. */
    SIGNUP_BONUS
}
