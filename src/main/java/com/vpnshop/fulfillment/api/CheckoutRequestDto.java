package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CheckoutRequestDto {

    @NotNull(message = "providerType is required")
    private PaymentProviderType providerType;

    /** Amount the buyer is asked to pay in quotedCurrency; defaults to the order price. */
    @DecimalMin("0.000000001")
    private BigDecimal quotedAmount;

    private String quotedCurrency;
}
