package com.vpnshop.fulfillment.domain;

import lombok.Getter;

@Getter
public class IllegalStateTransitionException extends RuntimeException {

    private final String orderId;
    private final OrderState from;
    private final OrderState to;

    public IllegalStateTransitionException(String orderId, OrderState from, OrderState to) {
        super("Illegal transition for order " + orderId + ": " + from + " -> " + to);
        this.orderId = orderId;
        this.from = from;
        this.to = to;
    }
}
