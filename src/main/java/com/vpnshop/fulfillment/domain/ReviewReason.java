package com.vpnshop.fulfillment.domain;

/**
 * Why an item sits in the manual-review queue.
 */
public enum ReviewReason {
    ORPHANED_PAYMENT,
    AMOUNT_MISMATCH,
    LATE_PAYMENT,
    CONFLICTING_PAYMENT,
    PROVISIONING_FAILED,
    REVOKE_FAILED,
    NOTIFICATION_FAILED,
    REDRIVE_EXHAUSTED
}
