package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.ManualReviewEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReviewItemDto {

    String reviewId;
    ReviewReason reason;
    PaymentProviderType provider;
    String providerTransactionId;
    String orderId;
    String details;
    String status;
    String resolutionNote;
    Instant createdAt;
    Instant resolvedAt;

    public static ReviewItemDto from(ManualReviewEntity item) {
        return ReviewItemDto.builder()
                .reviewId(item.getReviewId())
                .reason(item.getReason())
                .provider(item.getProvider())
                .providerTransactionId(item.getProviderTransactionId())
                .orderId(item.getOrderId())
                .details(item.getDetails())
                .status(item.getStatus().name())
                .resolutionNote(item.getResolutionNote())
                .createdAt(item.getCreatedAt())
                .resolvedAt(item.getResolvedAt())
                .build();
    }
}
