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

import java.util.HashMap;
import java.util.Map;

/**
 * Crypto Pay (CryptoBot) invoice updates. The signature header is HMAC-SHA256 of the raw
 * body keyed with SHA-256 of the API token. The invoice {@code payload} string carries
 * either a payment reference or the older colon-separated purchase description
 * {@code buyer:months:price:action:keyId:host:plan:email:method}.
 */
@Slf4j
@Component
public class CryptoBotGatewayAdapter extends JsonWebhookAdapter {

    static final String SIGNATURE_HEADER = "crypto-pay-api-signature";
    private static final String PAID_UPDATE = "invoice_paid";
    private static final int LEGACY_PARTS = 9;

    private final FulfillmentProperties properties;

    public CryptoBotGatewayAdapter(ObjectMapper objectMapper, OrderReferenceResolver resolver,
                                   FulfillmentProperties properties) {
        super(objectMapper, resolver);
        this.properties = properties;
    }

    @Override
    public PaymentProviderType getProviderType() {
        return PaymentProviderType.CRYPTOBOT;
    }

    @Override
    public boolean verify(String rawPayload, HttpHeaders headers) {
        String token = properties.getProviders().getCryptobot().getApiToken();
        if (token == null || token.isBlank()) {
            log.error("CryptoBot API token is not configured; rejecting delivery");
            return false;
        }
        String signature = headers.getFirst(SIGNATURE_HEADER);
        if (signature == null) {
            return false;
        }
        String expected = WebhookSignatures.hmacSha256Hex(WebhookSignatures.sha256(token), rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, signature);
    }

    @Override
    public CanonicalPaymentEvent parse(String rawPayload) {
        JsonNode root = readTree(rawPayload);
        String updateType = requiredText(root, "update_type");
        JsonNode invoice = root.path("payload");
        if (!invoice.isObject()) {
            throw new MalformedPayloadException("CryptoBot update has no invoice payload");
        }
        String status = text(invoice, "status");
        boolean fiat = "fiat".equals(text(invoice, "currency_type"));
        String invoicePayload = text(invoice, "payload");

        Map<String, String> metadata = new HashMap<>();
        String reference = null;
        String buyerId = null;
        String hostId = null;
        if (invoicePayload != null) {
            String[] parts = invoicePayload.split(":", -1);
            if (parts.length >= LEGACY_PARTS) {
                buyerId = parts[0];
                hostId = parts[5];
                metadata.put(META_BUYER, parts[0]);
                metadata.put("months", parts[1]);
                metadata.put(META_PRICE, parts[2]);
                metadata.put("action", parts[3]);
                metadata.put("key_id", parts[4]);
                metadata.put(META_HOST, parts[5]);
                metadata.put("plan_id", parts[6]);
                metadata.put("payment_method", parts[8]);
            } else {
                reference = invoicePayload;
            }
        }

        return CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.CRYPTOBOT)
                .providerTransactionId(requiredText(invoice, "invoice_id"))
                .paymentConfirmed(PAID_UPDATE.equals(updateType) && (status == null || "paid".equals(status)))
                .providerStatus(updateType + "/" + status)
                .amount(decimal(invoice, "amount"))
                .currency(fiat ? text(invoice, "fiat") : text(invoice, "asset"))
                .orderReference(reference)
                .buyerId(buyerId)
                .hostId(hostId)
                .paidAt(instantOrNull(text(invoice, "paid_at")))
                .metadata(metadata)
                .build();
    }
}
