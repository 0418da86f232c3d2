package com.vpnshop.fulfillment.domain;

/**
 * Network failure, timeout, 5xx/429, open circuit or a full per-host queue. Retryable.
 */
public class HostUnreachableException extends ProvisioningException {

    public HostUnreachableException(String hostId, String message) {
        super(hostId, message, null);
    }

    public HostUnreachableException(String hostId, String message, Throwable cause) {
        super(hostId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorCode() {
        return "HOST_UNREACHABLE";
    }
}
