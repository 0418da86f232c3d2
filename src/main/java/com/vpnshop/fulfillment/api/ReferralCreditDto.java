package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import com.vpnshop.fulfillment.persistence.entity.ReferralCreditEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ReferralCreditDto {

    String creditId;
    String referredBuyerId;
    String sourceOrderId;
    ReferralCreditKind kind;
    BigDecimal amount;
    String currencyCode;
    Instant createdAt;

    public static ReferralCreditDto from(ReferralCreditEntity credit) {
        return ReferralCreditDto.builder()
                .creditId(credit.getCreditId())
                .referredBuyerId(credit.getReferredBuyerId())
                .sourceOrderId(credit.getSourceOrderId())
                .kind(credit.getKind())
                .amount(credit.getAmount())
                .currencyCode(credit.getCurrencyCode())
                .createdAt(credit.getCreatedAt())
                .build();
    }
}
