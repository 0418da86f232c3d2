package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.SecretMasker;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderKind;
import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composes buyer messages for order outcomes and hands them to the
 * {@link NotificationDispatcher}. Pending flags are cleared only after delivery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderNotifier {

    private static final DateTimeFormatter EXPIRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final NotificationDispatcher dispatcher;
    private final OrderLedger ledger;

    /** Delivers whichever outcome notices the order still owes its buyer. */
    public void sendPending(String orderId) {
        OrderEntity order = ledger.getOrder(orderId);
        if (order.isNotificationPending()) {
            if (order.getState() == OrderState.FULFILLED) {
                sendIssued(order);
            }
            ledger.clearNotificationPending(orderId);
        }
        if (order.isFailureNotificationPending()) {
            Map<String, Object> payload = payload(order);
            payload.put("refundEligible", order.isRefundEligible());
            dispatcher.notify(order.getBuyerId(),
                    "We received your payment for order " + orderId + " but could not issue your VPN key. "
                            + "The order is flagged for a refund and support will contact you. "
                            + "Quote the order id if you write to support.",
                    payload);
            ledger.clearFailureNotificationPending(orderId);
            log.info("Failure notice delivered: orderId={}, buyerId={}", orderId, order.getBuyerId());
        }
    }

    public void paymentUnderReview(String orderId, CanonicalPaymentEvent event) {
        OrderEntity order = ledger.getOrder(orderId);
        Map<String, Object> payload = payload(order);
        payload.put("receivedAmount", event.getAmount());
        payload.put("receivedCurrency", event.getCurrency());
        dispatcher.notify(order.getBuyerId(),
                "Your payment of " + event.getAmount() + " " + event.getCurrency() + " for order " + orderId
                        + " does not match the expected " + order.expectedAmount() + " " + order.expectedCurrency()
                        + ". It is being reviewed by support; no need to pay again.",
                payload);
    }

    public void paymentAfterExpiry(String orderId, CanonicalPaymentEvent event) {
        OrderEntity order = ledger.getOrder(orderId);
        Map<String, Object> payload = payload(order);
        payload.put("receivedAmount", event.getAmount());
        dispatcher.notify(order.getBuyerId(),
                "We received " + event.getAmount() + " " + event.getCurrency() + " for order " + orderId
                        + " after it was closed. Support will review the payment and contact you.",
                payload);
    }

    public void expiryReminder(ProvisioningRecordEntity record, int hoursLeft) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", record.getOrderId());
        payload.put("expiresAt", record.getExpiresAt());
        payload.put("hoursLeft", hoursLeft);
        dispatcher.notify(record.getBuyerId(),
                "Your VPN key expires in about " + hoursLeft + " h (" + format(record.getExpiresAt())
                        + "). Renew it from the bot menu to keep the same key.",
                payload);
    }

    private void sendIssued(OrderEntity order) {
        ProvisioningRecordEntity record = ledger.findRecord(OrderLedger.credentialOwnerId(order))
                .orElseThrow(() -> new IllegalStateException("Fulfilled order has no record: " + order.getOrderId()));
        Map<String, Object> payload = payload(order);
        payload.put("subscriptionLink", record.getSubscriptionLink());
        payload.put("expiresAt", record.getExpiresAt());
        String message;
        if (order.getKind() == OrderKind.RENEWAL) {
            message = "Your VPN key has been extended until " + format(record.getExpiresAt()) + ".";
        } else {
            message = "Your VPN key is ready. Valid until " + format(record.getExpiresAt()) + ".\n"
                    + "Subscription link: " + record.getSubscriptionLink();
        }
        dispatcher.notify(order.getBuyerId(), message, payload);
        log.info("Credential notice delivered: orderId={}, buyerId={}, link={}", order.getOrderId(), order.getBuyerId(),
                SecretMasker.maskSubscriptionLink(record.getSubscriptionLink()));
    }

    private static Map<String, Object> payload(OrderEntity order) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getOrderId());
        payload.put("planId", order.getPlanId());
        payload.put("state", order.getState().name());
        return payload;
    }

    private static String format(Instant instant) {
        return instant != null ? EXPIRY_FORMAT.format(instant) : "unknown";
    }
}
