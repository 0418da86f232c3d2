package com.vpnshop.fulfillment.messaging;

import com.vpnshop.fulfillment.domain.OrderState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Emitted to Kafka on every order transition. Consumed by the admin panel and for
 * audit/reconciliation; keyed by order id so one order's events stay ordered.
 */
@Value
@Builder
@Jacksonized
public class OrderEvent {

    String eventId;
    String orderId;
    String buyerId;
    String hostId;
    String planId;
    OrderState previousState;
    OrderState state;
    String paymentProvider;
    String providerTransactionId;
    BigDecimal amount;
    String currencyCode;
    /** Short reason, e.g. HOST_REJECTED for a failure. */
    String detail;
    Instant timestamp;
}
