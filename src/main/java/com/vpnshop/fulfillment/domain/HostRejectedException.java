package com.vpnshop.fulfillment.domain;

/**
 * The host understood the call and refused it (unknown inbound, quota, invalid plan).
 * Needs an operator; retrying would only repeat the refusal.
 */
public class HostRejectedException extends ProvisioningException {

    public HostRejectedException(String hostId, String message) {
        super(hostId, message, null);
    }

    public HostRejectedException(String hostId, String message, Throwable cause) {
        super(hostId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getErrorCode() {
        return "HOST_REJECTED";
    }
}
