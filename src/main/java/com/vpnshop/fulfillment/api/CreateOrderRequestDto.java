package com.vpnshop.fulfillment.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body for creating an order. The nonce scopes idempotency: the same buyer, plan and
 * nonce always return the same order.
 */
@Data
public class CreateOrderRequestDto {

    @NotBlank(message = "buyerId is required")
    private String buyerId;

    @NotBlank(message = "planId is required")
    private String planId;

    /** Ignored for renewals, which stay on the renewed credential's host. */
    private String hostId;

    @NotBlank(message = "nonce is required")
    private String nonce;

    private String renewalOfOrderId;
}
