package com.vpnshop.fulfillment.domain;

/**
 * What a processed payment event did. Unprocessed events have no outcome yet.
 */
public enum PaymentEventOutcome {
    CONFIRMED,
    DUPLICATE,
    ORPHANED,
    AMOUNT_MISMATCH,
    LATE_PAYMENT,
    CONFLICTING_PAYMENT
}
