package com.vpnshop.fulfillment.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterBuyerRequestDto {

    @NotBlank(message = "buyerId is required")
    private String buyerId;

    /** Who invited the buyer; only the first non-self referrer is kept. */
    private String referrerId;
}
