package com.vpnshop.fulfillment.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Marker cached for a (provider, transaction id) pair once its payment event is processed.
 */
@Value
@Builder
@Jacksonized
public class ProcessedWebhook {

    PaymentProviderType provider;
    String providerTransactionId;
    String orderId;
    PaymentEventOutcome outcome;
    Instant processedAt;
}
