package com.vpnshop.fulfillment.core;

/**
 * Verdict on one webhook delivery, with the HTTP status the provider sees.
 */
public enum IngestOutcome {
    /** Payment confirmed an order. */
    ACCEPTED(200),
    /** Already processed; nothing changed. */
    DUPLICATE(200),
    /** Valid notification that confirms no payment. */
    IGNORED(200),
    /** No order could be matched; queued for an operator. */
    ORPHANED(200),
    /** Matched an order but could not be applied (amount, late, conflicting); queued for an operator. */
    HELD_FOR_REVIEW(200),
    MALFORMED(400),
    REJECTED(401),
    /** Transient failure; the provider should deliver again. */
    RETRY_LATER(503);

    private final int httpStatus;

    IngestOutcome(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
