package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.domain.OrderKind;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST view of an order.
 */
@Value
@Builder
public class OrderResponseDto {

    String orderId;
    String buyerId;
    String planId;
    String hostId;
    OrderKind kind;
    String renewalOfOrderId;
    OrderState state;
    BigDecimal price;
    String currencyCode;
    PaymentProviderType paymentProvider;
    String paymentReference;
    BigDecimal quotedAmount;
    String quotedCurrency;
    String providerTransactionId;
    Instant paidAt;
    Instant targetExpiresAt;
    int provisioningAttempts;
    boolean refundEligible;
    boolean reviewRequired;
    Instant createdAt;
    Instant updatedAt;

    public static OrderResponseDto from(OrderEntity order) {
        if (order == null) {
            throw new IllegalArgumentException("OrderEntity cannot be null");
        }
        return OrderResponseDto.builder()
                .orderId(order.getOrderId())
                .buyerId(order.getBuyerId())
                .planId(order.getPlanId())
                .hostId(order.getHostId())
                .kind(order.getKind())
                .renewalOfOrderId(order.getRenewalOfOrderId())
                .state(order.getState())
                .price(order.getPrice())
                .currencyCode(order.getCurrencyCode())
                .paymentProvider(order.getPaymentProvider())
                .paymentReference(order.getPaymentReference())
                .quotedAmount(order.getQuotedAmount())
                .quotedCurrency(order.getQuotedCurrency())
                .providerTransactionId(order.getProviderTransactionId())
                .paidAt(order.getPaidAt())
                .targetExpiresAt(order.getTargetExpiresAt())
                .provisioningAttempts(order.getProvisioningAttempts())
                .refundEligible(order.isRefundEligible())
                .reviewRequired(order.isReviewRequired())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
