package com.vpnshop.fulfillment.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything a host client needs to create or extend one credential. Built by
 * the state machine from ledger data; the client never reads the ledger itself.
 */
@Value
@Builder
public class ProvisioningRequest {

    String orderId;
    String hostId;
    String buyerId;
    /** Stable email-like identifier used to find an existing credential on the host. */
    String clientReference;
    /** Stable client UUID derived from the order idempotency key. */
    String clientUuid;
    /** Absolute expiry the credential must carry after the call. */
    Instant expiresAt;
    /** 0 means unlimited. */
    long trafficLimitBytes;
    boolean renewal;
}
