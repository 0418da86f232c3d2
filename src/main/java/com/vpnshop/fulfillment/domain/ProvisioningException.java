package com.vpnshop.fulfillment.domain;

import lombok.Getter;

/**
 * Classified failure of a host call. Subclasses decide whether the order may be
 * retried; clients must never throw anything else for a failed remote call.
 */
@Getter
public abstract class ProvisioningException extends RuntimeException {

    private final String hostId;

    protected ProvisioningException(String hostId, String message, Throwable cause) {
        super(message, cause);
        this.hostId = hostId;
    }

    public abstract boolean isRetryable();

    /** Short code stored on the order as the last provisioning error. */
    public abstract String getErrorCode();
}
