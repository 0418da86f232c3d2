package com.vpnshop.fulfillment.domain;

import lombok.Value;

/**
 * Result of matching a payment event to an order. An orphaned resolution is never
 * guessed into a match; it goes to manual review.
 */
@Value
public class OrderResolution {

    String orderId;
    String reason;

    public static OrderResolution matched(String orderId) {
        return new OrderResolution(orderId, null);
    }

    public static OrderResolution orphaned(String reason) {
        return new OrderResolution(null, reason);
    }

    public boolean isMatched() {
        return orderId != null;
    }
}
