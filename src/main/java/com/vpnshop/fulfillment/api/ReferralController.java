package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.ReferralLedger;
import com.vpnshop.fulfillment.persistence.entity.BuyerEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/referrals")
@RequiredArgsConstructor
@Tag(name = "Referrals", description = "Buyer registration, referral balances and credit history")
public class ReferralController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ReferralLedger referralLedger;

    @PostMapping("/buyers")
    @Operation(summary = "Register buyer", description = "Records a buyer and, once, who referred them.")
    public ResponseEntity<Map<String, Object>> registerBuyer(@Valid @RequestBody RegisterBuyerRequestDto dto) {
        BuyerEntity buyer = referralLedger.registerBuyer(dto.getBuyerId(), dto.getReferrerId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("buyerId", buyer.getBuyerId());
        body.put("referrerId", buyer.getReferrerId());
        body.put("registeredAt", buyer.getRegisteredAt());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{userId}/balance")
    @Operation(summary = "Referral balance", description = "Sum of all credits earned by the user, in the ledger currency.")
    public ResponseEntity<ReferralLedger.ReferralBalance> balance(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(referralLedger.getBalance(userId));
    }

    @GetMapping("/{userId}/credits")
    @Operation(summary = "Credit history", description = "Newest first.")
    public ResponseEntity<Page<ReferralCreditDto>> credits(@PathVariable("userId") String userId,
                                                           @RequestParam(name = "page", defaultValue = "0") int page,
                                                           @RequestParam(name = "size", defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        return ResponseEntity.ok(referralLedger.credits(userId, pageable).map(ReferralCreditDto::from));
    }
}
