package com.vpnshop.fulfillment.core;

/**
 * Verified webhook body that cannot be turned into a payment event.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
