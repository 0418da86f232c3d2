package com.vpnshop.fulfillment.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a purchase order. States only move forward; the four terminal
 * states are never left once reached.
 */
public enum OrderState {
    /** Buyer confirmed intent to pay; no checkout issued yet. */
    CREATED,
    /** Checkout issued with a payment reference; waiting for the provider callback. */
    AWAITING_PAYMENT,
    /** Payment verified and recorded; provisioning intent written. */
    PAYMENT_CONFIRMED,
    /** A host call is in flight or scheduled for retry. */
    PROVISIONING,
    /** Credential issued and recorded. */
    FULFILLED,
    /** No payment arrived within the payment timeout. */
    EXPIRED,
    /** Provisioning gave up; refund-eligible and queued for an operator. */
    FAILED,
    /** Refunded by an operator after fulfillment. */
    REFUNDED;

    private static final Map<OrderState, Set<OrderState>> VALID_TRANSITIONS = new EnumMap<>(OrderState.class);

    static {
        VALID_TRANSITIONS.put(CREATED, EnumSet.of(AWAITING_PAYMENT, EXPIRED));
        VALID_TRANSITIONS.put(AWAITING_PAYMENT, EnumSet.of(PAYMENT_CONFIRMED, EXPIRED));
        VALID_TRANSITIONS.put(PAYMENT_CONFIRMED, EnumSet.of(PROVISIONING));
        VALID_TRANSITIONS.put(PROVISIONING, EnumSet.of(FULFILLED, FAILED));
        VALID_TRANSITIONS.put(FULFILLED, EnumSet.of(REFUNDED));
        VALID_TRANSITIONS.put(EXPIRED, EnumSet.noneOf(OrderState.class));
        VALID_TRANSITIONS.put(FAILED, EnumSet.noneOf(OrderState.class));
        VALID_TRANSITIONS.put(REFUNDED, EnumSet.noneOf(OrderState.class));
    }

    public boolean canTransitionTo(OrderState target) {
        return VALID_TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderState> nextStates() {
        return Collections.unmodifiableSet(VALID_TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return VALID_TRANSITIONS.get(this).isEmpty() || this == FULFILLED;
    }

    /** True once a payment has been recorded against the order. */
    public boolean isPaid() {
        return this == PAYMENT_CONFIRMED || this == PROVISIONING || this == FULFILLED
                || this == FAILED || this == REFUNDED;
    }

    public boolean isAwaitingPayment() {
        return this == CREATED || this == AWAITING_PAYMENT;
    }
}
