package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.MalformedPayloadException;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.core.WebhookSignatures;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * YooKassa payment notifications ({@code payment.succeeded} and friends). The body is
 * signed with HMAC-SHA256 over the raw bytes using the shop's webhook secret.
 */
@Slf4j
@Component
public class YooKassaGatewayAdapter extends JsonWebhookAdapter {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    private static final String SUCCEEDED_EVENT = "payment.succeeded";

    private final FulfillmentProperties properties;

    public YooKassaGatewayAdapter(ObjectMapper objectMapper, OrderReferenceResolver resolver,
                                  FulfillmentProperties properties) {
        super(objectMapper, resolver);
        this.properties = properties;
    }

    @Override
    public PaymentProviderType getProviderType() {
        return PaymentProviderType.YOOKASSA;
    }

    @Override
    public boolean verify(String rawPayload, HttpHeaders headers) {
        String secret = properties.getProviders().getYookassa().getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("YooKassa webhook secret is not configured; rejecting delivery");
            return false;
        }
        String signature = headers.getFirst(SIGNATURE_HEADER);
        if (signature == null) {
            return false;
        }
        String expected = WebhookSignatures.hmacSha256Hex(secret.getBytes(StandardCharsets.UTF_8), rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, signature);
    }

    @Override
    public CanonicalPaymentEvent parse(String rawPayload) {
        JsonNode root = readTree(rawPayload);
        String event = requiredText(root, "event");
        JsonNode payment = root.path("object");
        if (!payment.isObject()) {
            throw new MalformedPayloadException("YooKassa payload has no object");
        }
        String status = text(payment, "status");
        Map<String, String> metadata = flatten(payment.path("metadata"));
        return CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.YOOKASSA)
                .providerTransactionId(requiredText(payment, "id"))
                .paymentConfirmed(SUCCEEDED_EVENT.equals(event) && "succeeded".equals(status))
                .providerStatus(event + "/" + status)
                .amount(decimal(payment.path("amount"), "value"))
                .currency(text(payment.path("amount"), "currency"))
                .orderReference(firstNonNull(metadata.get("payment_reference"), metadata.get("order_id")))
                .buyerId(metadata.get(META_BUYER))
                .hostId(metadata.get(META_HOST))
                .paidAt(instantOrNull(firstNonNull(text(payment, "captured_at"), text(payment, "created_at"))))
                .metadata(metadata)
                .build();
    }
}
