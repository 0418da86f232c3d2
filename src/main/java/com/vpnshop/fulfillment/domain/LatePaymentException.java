package com.vpnshop.fulfillment.domain;

import lombok.Getter;

/**
 * Payment arrived for an order that can no longer accept one (expired, failed, refunded).
 */
@Getter
public class LatePaymentException extends RuntimeException {

    private final String orderId;
    private final OrderState state;

    public LatePaymentException(String orderId, OrderState state) {
        super("Order " + orderId + " cannot accept payment in state " + state);
        this.orderId = orderId;
        this.state = state;
    }
}
