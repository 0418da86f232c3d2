package com.vpnshop.fulfillment.core;

import lombok.Builder;
import lombok.Value;

/**
 * Purchase intent from the bot. {@code nonce} is client-supplied so a resubmitted
 * button press maps to the same order.
 */
@Value
@Builder
public class CreateOrderCommand {

    String buyerId;
    String planId;
    /** Ignored for renewals, which stay on the renewed order's host. */
    String hostId;
    String nonce;
    String renewalOfOrderId;
}
