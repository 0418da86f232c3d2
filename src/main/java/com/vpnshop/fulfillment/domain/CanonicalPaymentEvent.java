package com.vpnshop.fulfillment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Provider-agnostic view of one inbound payment notification. Adapters fill in
 * whatever correlation data their payload carries; the rest stays null.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalPaymentEvent {

    PaymentProviderType provider;
    String providerTransactionId;
    /** False for well-formed notifications that do not confirm a payment (pending, cancelled). */
    boolean paymentConfirmed;
    /** Provider-side status string, kept for logs. */
    String providerStatus;
    BigDecimal amount;
    String currency;
    /** Payment reference or order id embedded by checkout, if the provider echoed it. */
    String orderReference;
    /** Buyer id recovered from legacy metadata, used only for correlation. */
    String buyerId;
    /** Host id recovered from legacy metadata, used only for correlation. */
    String hostId;
    Instant paidAt;
    Map<String, String> metadata;
}
