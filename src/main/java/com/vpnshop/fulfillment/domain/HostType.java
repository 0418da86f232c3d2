package com.vpnshop.fulfillment.domain;

/**
 * Remote panel flavours a host can run. Each maps to one
 * {@link com.vpnshop.fulfillment.core.HostProvisioningClient}.
 */
public enum HostType {
    /** 3x-ui panel: clients live inside an inbound's settings. */
    XUI,
    /** Remnawave panel: users with internal squads, bearer-token API. */
    REMNAWAVE
}
