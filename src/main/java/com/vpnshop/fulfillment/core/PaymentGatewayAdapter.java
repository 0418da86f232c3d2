package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderResolution;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import org.springframework.http.HttpHeaders;

/**
 * What every payment back-end integration implements. Takes a raw webhook delivery,
 * proves it came from the provider, turns it into a {@link CanonicalPaymentEvent} and
 * finds the order it pays for. The ingress wraps these calls with dedup, persistence
 * and the state machine; adapters never touch orders directly.
 */
public interface PaymentGatewayAdapter {

    PaymentProviderType getProviderType();

    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Authenticates the delivery. Must not throw for a bad or missing signature.
     *
     * @param rawPayload request body exactly as received
     * @param headers    request headers
     * @return true only when the provider's scheme validates
     */
    boolean verify(String rawPayload, HttpHeaders headers);

    /**
     * Normalizes a verified payload.
     *
     * @throws MalformedPayloadException when required fields are missing or unreadable
     */
    CanonicalPaymentEvent parse(String rawPayload);

    /**
     * Correlates the event to exactly one order, or reports it orphaned. Never guesses
     * between several candidates.
     */
    OrderResolution resolveOrder(CanonicalPaymentEvent event);
}
