package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import com.vpnshop.fulfillment.persistence.entity.BuyerEntity;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.entity.ReferralCreditEntity;
import com.vpnshop.fulfillment.persistence.repository.BuyerRepository;
import com.vpnshop.fulfillment.persistence.repository.ReferralCreditRepository;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Credits referrers for fulfilled orders. Each enabled rule yields at most one credit
 * per order (unique on order and kind) and the signup bonus at most one per referred
 * buyer (unique on the buyer), so a re-run settlement adds nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferralLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final OrderLedger ledger;
    private final ReferralCreditRepository creditRepository;
    private final BuyerRepository buyerRepository;
    private final FulfillmentProperties properties;
    private final AuditLogger auditLogger;
    private final Clock clock;

    @Transactional
    public List<ReferralCreditEntity> settle(String orderId) {
        OrderEntity order = ledger.lockOrder(orderId);
        if (order.getState() != OrderState.FULFILLED || !order.isSettlementPending()) {
            log.debug("Nothing to settle for orderId={}, state={}, pending={}",
                    orderId, order.getState(), order.isSettlementPending());
            return Collections.emptyList();
        }
        String buyerId = order.getBuyerId();
        Optional<BuyerEntity> buyer = buyerRepository.findByIdForUpdate(buyerId);
        String referrerId = buyer.map(BuyerEntity::getReferrerId).orElse(null);

        List<ReferralCreditEntity> created = new ArrayList<>();
        if (referrerId != null && !referrerId.equals(buyerId)) {
            FulfillmentProperties.Referral rules = properties.getReferral();
            EnumSet<ReferralCreditKind> kinds = rules.getEnabledKinds().isEmpty()
                    ? EnumSet.noneOf(ReferralCreditKind.class)
                    : EnumSet.copyOf(rules.getEnabledKinds());
            for (ReferralCreditKind kind : kinds) {
                if (creditRepository.existsBySourceOrderIdAndKind(orderId, kind)) {
                    continue;
                }
                if (kind == ReferralCreditKind.SIGNUP_BONUS && creditRepository.existsBySignupBuyerId(buyerId)) {
                    continue;
                }
                BigDecimal amount = amountFor(kind, order, rules);
                if (amount.signum() <= 0) {
                    continue;
                }
                ReferralCreditEntity credit = creditRepository.save(ReferralCreditEntity.builder()
                        .creditId(UUID.randomUUID().toString())
                        .referrerId(referrerId)
                        .referredBuyerId(buyerId)
                        .sourceOrderId(orderId)
                        .kind(kind)
                        .signupBuyerId(kind == ReferralCreditKind.SIGNUP_BONUS ? buyerId : null)
                        .amount(amount)
                        .currencyCode(rules.getCurrency())
                        .createdAt(clock.instant())
                        .build());
                auditLogger.logReferralCredit(credit);
                created.add(credit);
            }
        }
        Instant now = clock.instant();
        order.setSettlementPending(false);
        order.setSettledAt(now);
        order.setUpdatedAt(now);
        log.info("Order settled: orderId={}, referrerId={}, credits={}", orderId, referrerId, created.size());
        return created;
    }

    @Transactional(readOnly = true)
    public ReferralBalance getBalance(String userId) {
        FulfillmentProperties.Referral rules = properties.getReferral();
        BigDecimal balance = creditRepository.sumByReferrerId(userId).setScale(2, RoundingMode.HALF_UP);
        BigDecimal minimum = rules.getMinimumWithdrawal();
        boolean withdrawable = balance.signum() > 0 && (minimum == null || balance.compareTo(minimum) >= 0);
        return new ReferralBalance(userId, balance, rules.getCurrency(), withdrawable, minimum,
                creditRepository.countByReferrerId(userId), buyerRepository.countByReferrerId(userId));
    }

    /**
     * Registers a buyer as the bot first sees them. The referrer sticks to whoever
     * invited the buyer first and can never be the buyer.
     */
    @Transactional
    public BuyerEntity registerBuyer(String buyerId, String referrerId) {
        String referrer = referrerId == null || referrerId.isBlank() || referrerId.equals(buyerId) ? null : referrerId;
        Optional<BuyerEntity> existing = buyerRepository.findByIdForUpdate(buyerId);
        if (existing.isPresent()) {
            BuyerEntity buyer = existing.get();
            if (buyer.getReferrerId() == null && referrer != null) {
                buyer.setReferrerId(referrer);
                log.info("Referrer attached: buyerId={}, referrerId={}", buyerId, referrer);
            }
            return buyer;
        }
        log.info("Buyer registered: buyerId={}, referrerId={}", buyerId, referrer);
        return buyerRepository.save(BuyerEntity.builder()
                .buyerId(buyerId)
                .referrerId(referrer)
                .registeredAt(clock.instant())
                .build());
    }

    @Transactional(readOnly = true)
    public Page<ReferralCreditEntity> credits(String referrerId, Pageable pageable) {
        return creditRepository.findByReferrerIdOrderByCreatedAtDesc(referrerId, pageable);
    }

    private static BigDecimal amountFor(ReferralCreditKind kind, OrderEntity order, FulfillmentProperties.Referral rules) {
        switch (kind) {
            case PERCENTAGE:
                return order.getPrice().multiply(rules.getPercentage()).divide(HUNDRED, 2, RoundingMode.HALF_UP);
            case FIXED_PER_PURCHASE:
                return rules.getFixedPurchaseAmount().setScale(2, RoundingMode.HALF_UP);
            case SIGNUP_BONUS:
                return rules.getSignupBonusAmount().setScale(2, RoundingMode.HALF_UP);
            default:
                throw new IllegalArgumentException("Unknown credit kind " + kind);
        }
    }

    @Value
    public static class ReferralBalance {
        String userId;
        BigDecimal balance;
        String currency;
        boolean withdrawable;
        BigDecimal minimumWithdrawal;
        long creditCount;
        long referredBuyers;
    }
}
