package com.vpnshop.fulfillment.domain;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Paid amount or currency does not match what the order expects. The order is left
 * waiting for payment and the event goes to manual review.
 */
@Getter
public class AmountMismatchException extends RuntimeException {

    private final String orderId;
    private final BigDecimal expectedAmount;
    private final String expectedCurrency;
    private final BigDecimal receivedAmount;
    private final String receivedCurrency;

    public AmountMismatchException(String orderId, BigDecimal expectedAmount, String expectedCurrency,
                                   BigDecimal receivedAmount, String receivedCurrency) {
        super("Amount mismatch for order " + orderId + ": expected " + expectedAmount + " " + expectedCurrency
                + ", received " + receivedAmount + " " + receivedCurrency);
        this.orderId = orderId;
        this.expectedAmount = expectedAmount;
        this.expectedCurrency = expectedCurrency;
        this.receivedAmount = receivedAmount;
        this.receivedCurrency = receivedCurrency;
    }
}
