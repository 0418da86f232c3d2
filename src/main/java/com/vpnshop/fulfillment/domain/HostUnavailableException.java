package com.vpnshop.fulfillment.domain;

/**
 * New orders are refused for a host flagged unhealthy or not configured.
 */
public class HostUnavailableException extends RuntimeException {

    public HostUnavailableException(String message) {
        super(message);
    }
}
