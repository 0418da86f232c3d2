package com.vpnshop.fulfillment.domain;

/**
 * Panel credentials were refused. The host is flagged unhealthy until an operator clears it.
 */
public class HostAuthFailedException extends ProvisioningException {

    public HostAuthFailedException(String hostId, String message) {
        super(hostId, message, null);
    }

    public HostAuthFailedException(String hostId, String message, Throwable cause) {
        super(hostId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getErrorCode() {
        return "HOST_AUTH_FAILED";
    }
}
