package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.OrderResolution;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Correlation strategies shared by the gateway adapters. Every strategy answers with
 * exactly one order or an orphan reason; more than one candidate is always an orphan.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderReferenceResolver {

    private final OrderRepository orderRepository;
    private final FulfillmentProperties properties;
    private final Clock clock;

    /** Payment reference issued at checkout, or a raw order id from older invoices. */
    @Transactional(readOnly = true)
    public Optional<String> byReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        Optional<OrderEntity> byPaymentReference = orderRepository.findByPaymentReference(trimmed);
        if (byPaymentReference.isPresent()) {
            return Optional.of(byPaymentReference.get().getOrderId());
        }
        return orderRepository.findById(trimmed).map(OrderEntity::getOrderId);
    }

    /**
     * Single awaiting order on this provider whose quote matches the amount and whose
     * checkout falls within the window before the payment.
     */
    @Transactional(readOnly = true)
    public OrderResolution byAmountWindow(PaymentProviderType provider, String currency, BigDecimal amount,
                                          Instant paidAt, Duration window) {
        if (amount == null || currency == null) {
            return OrderResolution.orphaned("no amount to correlate");
        }
        BigDecimal tolerance = properties.getOrders().getAmountTolerance();
        Instant anchor = paidAt != null ? paidAt : clock.instant();
        List<OrderEntity> candidates = orderRepository.findPaymentCandidates(OrderState.AWAITING_PAYMENT, provider,
                currency, amount.subtract(tolerance), amount.add(tolerance), anchor.minus(window));
        return single(candidates, "amount " + amount + " " + currency + " within " + window);
    }

    /** Legacy invoices that only carry buyer, host and price. */
    @Transactional(readOnly = true)
    public OrderResolution byBuyerHostAmount(String buyerId, String hostId, BigDecimal amount) {
        if (buyerId == null || hostId == null || amount == null) {
            return OrderResolution.orphaned("legacy metadata incomplete");
        }
        BigDecimal tolerance = properties.getOrders().getAmountTolerance();
        List<OrderEntity> candidates = orderRepository.findOpenOrdersForBuyerOnHost(buyerId, hostId,
                        EnumSet.of(OrderState.CREATED, OrderState.AWAITING_PAYMENT)).stream()
                .filter(o -> o.expectedAmount().subtract(amount).abs().compareTo(tolerance) <= 0)
                .collect(Collectors.toList());
        return single(candidates, "buyer " + buyerId + " on host " + hostId + " for " + amount);
    }

    private static OrderResolution single(List<OrderEntity> candidates, String criteria) {
        if (candidates.size() == 1) {
            return OrderResolution.matched(candidates.get(0).getOrderId());
        }
        if (candidates.isEmpty()) {
            return OrderResolution.orphaned("no open order matches " + criteria);
        }
        log.warn("Ambiguous correlation: {} orders match {}", candidates.size(), criteria);
        return OrderResolution.orphaned(candidates.size() + " orders match " + criteria);
    }
}
