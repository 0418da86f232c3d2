package com.vpnshop.fulfillment.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Payment back-ends that deliver confirmations to the webhook endpoints.
 * The path tag of each endpoint selects exactly one of these, and each has one
 * {@link com.vpnshop.fulfillment.core.PaymentGatewayAdapter}.
 */
public enum PaymentProviderType {
    /** YooKassa card/SBP payments (fiat). */
    YOOKASSA("yookassa"),
    /** Crypto Pay bot invoices. */
    CRYPTOBOT("cryptobot"),
    /** Heleket crypto invoices. */
    HELEKET("heleket"),
    /** Direct TON transfers observed through TonAPI webhooks. */
    TONAPI("tonapi");

    private final String pathTag;

    PaymentProviderType(String pathTag) {
        this.pathTag = pathTag;
    }

    public String getPathTag() {
        return pathTag;
    }

    public static Optional<PaymentProviderType> fromPathTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.pathTag.equals(normalized))
                .findFirst();
    }
}
