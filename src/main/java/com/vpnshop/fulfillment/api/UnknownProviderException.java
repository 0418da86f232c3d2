package com.vpnshop.fulfillment.api;

/**
 * Webhook path names a provider this service does not accept.
 */
public class UnknownProviderException extends RuntimeException {

    public UnknownProviderException(String tag) {
        super("Unknown payment provider: " + tag);
    }
}
