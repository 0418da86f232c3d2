package com.vpnshop.fulfillment.domain;

import lombok.Getter;

/**
 * A second, different provider transaction for an order that is already paid.
 */
@Getter
public class ConflictingPaymentException extends RuntimeException {

    private final String orderId;
    private final String recordedTransactionId;
    private final String incomingTransactionId;

    public ConflictingPaymentException(String orderId, String recordedTransactionId, String incomingTransactionId) {
        super("Order " + orderId + " already paid by " + recordedTransactionId + ", got " + incomingTransactionId);
        this.orderId = orderId;
        this.recordedTransactionId = recordedTransactionId;
        this.incomingTransactionId = incomingTransactionId;
    }
}
