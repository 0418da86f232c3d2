package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.core.WebhookSignatures;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderResolution;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Direct TON transfers to the shop wallet, reported by a TonAPI account webhook. Only
 * committed transactions count; in-progress ones are ignored until TonAPI reports them
 * again. A transfer is matched by its comment, or failing that by amount within the
 * configured window.
 */
@Slf4j
@Component
public class TonApiGatewayAdapter extends JsonWebhookAdapter {

    static final String CURRENCY = "TON";
    private static final BigDecimal NANO_PER_TON = BigDecimal.valueOf(1_000_000_000L);
    private static final String BEARER = "Bearer ";

    private final FulfillmentProperties properties;

    public TonApiGatewayAdapter(ObjectMapper objectMapper, OrderReferenceResolver resolver,
                                FulfillmentProperties properties) {
        super(objectMapper, resolver);
        this.properties = properties;
    }

    @Override
    public PaymentProviderType getProviderType() {
        return PaymentProviderType.TONAPI;
    }

    @Override
    public boolean verify(String rawPayload, HttpHeaders headers) {
        String token = properties.getProviders().getTonapi().getWebhookToken();
        if (token == null || token.isBlank()) {
            log.error("TonAPI webhook token is not configured; rejecting delivery");
            return false;
        }
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER)) {
            return false;
        }
        return WebhookSignatures.constantTimeEquals(token, authorization.substring(BEARER.length()));
    }

    @Override
    public CanonicalPaymentEvent parse(String rawPayload) {
        JsonNode root = readTree(rawPayload);
        String txId = requiredText(root, "tx_id");
        JsonNode tx = findTransaction(root.path("txs"), txId);
        JsonNode inMsg = tx != null ? tx.path("in_msg") : null;

        BigDecimal nano = inMsg != null ? decimal(inMsg, "value") : null;
        BigDecimal amount = nano != null ? nano.divide(NANO_PER_TON, 9, RoundingMode.HALF_UP).stripTrailingZeros() : null;
        String comment = inMsg != null ? text(inMsg, "decoded_comment") : null;
        Instant paidAt = tx != null && tx.path("utime").canConvertToLong() ? Instant.ofEpochSecond(tx.path("utime").asLong()) : null;

        Map<String, String> metadata = new HashMap<>();
        String account = text(root, "account_id");
        if (account != null) {
            metadata.put("account_id", account);
        }
        return CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.TONAPI)
                .providerTransactionId(txId)
                .paymentConfirmed(amount != null && amount.signum() > 0)
                .providerStatus(tx != null ? "committed" : "no committed transfer")
                .amount(amount)
                .currency(CURRENCY)
                .orderReference(comment)
                .paidAt(paidAt)
                .metadata(metadata)
                .build();
    }

    @Override
    public OrderResolution resolveOrder(CanonicalPaymentEvent event) {
        if (event.getOrderReference() != null) {
            Optional<String> orderId = resolver.byReference(event.getOrderReference());
            if (orderId.isPresent()) {
                return OrderResolution.matched(orderId.get());
            }
            log.info("TON comment {} matches no order; trying amount correlation", event.getOrderReference());
        }
        return resolver.byAmountWindow(PaymentProviderType.TONAPI, CURRENCY, event.getAmount(), event.getPaidAt(),
                properties.getProviders().getTonapi().getMatchWindow());
    }

    /** The committed transaction named by tx_id, else the first one with an inbound message. */
    private static JsonNode findTransaction(JsonNode txs, String txId) {
        if (!txs.isArray()) {
            return null;
        }
        JsonNode first = null;
        for (JsonNode tx : txs) {
            if (!tx.path("in_msg").isObject()) {
                continue;
            }
            if (txId.equals(text(tx, "hash"))) {
                return tx;
            }
            if (first == null) {
                first = tx;
            }
        }
        return first;
    }
}
