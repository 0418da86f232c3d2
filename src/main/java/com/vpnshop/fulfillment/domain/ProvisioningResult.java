package com.vpnshop.fulfillment.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProvisioningResult {

    String hostId;
    String remoteCredentialId;
    String clientReference;
    String subscriptionLink;
    Instant expiresAt;
    /** True when an existing remote credential was found and updated instead of created. */
    boolean reusedExisting;
}
