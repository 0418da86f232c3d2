package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;

import java.util.Optional;

/**
 * Remote panel that owns VPN credentials. Implementations classify every failure as a
 * {@link com.vpnshop.fulfillment.domain.ProvisioningException} subtype.
 */
public interface HostProvisioningClient {

    HostType getHostType();

    /**
     * Creates the client, or extends it when one with the same client reference already
     * exists. Calling twice with the same request leaves exactly one credential.
     */
    ProvisioningResult issueCredential(FulfillmentProperties.Host host, ProvisioningRequest request);

    Optional<ProvisioningResult> findCredential(FulfillmentProperties.Host host, String clientReference);

    /** Removing a credential that is already gone succeeds. */
    void revokeCredential(FulfillmentProperties.Host host, String remoteCredentialId, String clientReference);
}
