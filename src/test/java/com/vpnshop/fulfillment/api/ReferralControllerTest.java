package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.ReferralLedger;
import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import com.vpnshop.fulfillment.persistence.entity.BuyerEntity;
import com.vpnshop.fulfillment.persistence.entity.ReferralCreditEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ReferralController.class)
class ReferralControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReferralLedger referralLedger;

    @Test
    void registerBuyerReturnsStoredReferrer() throws Exception {
        when(referralLedger.registerBuyer("42", "7")).thenReturn(BuyerEntity.builder()
                .buyerId("42").referrerId("7").registeredAt(Instant.parse("2026-03-01T12:00:00Z")).build());

        mockMvc.perform(post("/api/v1/referrals/buyers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buyerId\":\"42\",\"referrerId\":\"7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buyerId").value("42"))
                .andExpect(jsonPath("$.referrerId").value("7"));
    }

    @Test
    void registerWithoutBuyerIdFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/referrals/buyers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"referrerId\":\"7\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.buyerId").value("buyerId is required"));

        verifyNoInteractions(referralLedger);
    }

    @Test
    void balanceIsReturnedInLedgerCurrency() throws Exception {
        when(referralLedger.getBalance("7")).thenReturn(new ReferralLedger.ReferralBalance(
                "7", new BigDecimal("39.80"), "RUB", true, BigDecimal.ZERO, 2, 1));

        mockMvc.perform(get("/api/v1/referrals/7/balance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(39.80))
                .andExpect(jsonPath("$.currency").value("RUB"))
                .andExpect(jsonPath("$.withdrawable").value(true))
                .andExpect(jsonPath("$.creditCount").value(2));
    }

    @Test
    void creditPageSizeIsCapped() throws Exception {
        ReferralCreditEntity credit = ReferralCreditEntity.builder()
                .creditId("c-1").referrerId("7").referredBuyerId("42").sourceOrderId("order-1")
                .kind(ReferralCreditKind.PERCENTAGE).amount(new BigDecimal("19.90")).currencyCode("RUB")
                .createdAt(Instant.parse("2026-03-01T12:00:00Z")).build();
        Pageable capped = PageRequest.of(0, 100);
        when(referralLedger.credits(eq("7"), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(credit), capped, 1));

        mockMvc.perform(get("/api/v1/referrals/7/credits").param("size", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].sourceOrderId").value("order-1"))
                .andExpect(jsonPath("$.content[0].kind").value("PERCENTAGE"));

        verify(referralLedger).credits("7", capped);
    }
}
