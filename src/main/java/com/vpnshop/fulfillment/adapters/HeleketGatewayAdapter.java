package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.core.WebhookSignatures;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heleket invoice callbacks. The signature travels in the body: {@code sign} is
 * md5(base64(key-sorted compact JSON of the other fields) + API key), with non-ASCII
 * characters written as lowercase hex unicode escapes.
 */
@Slf4j
@Component
public class HeleketGatewayAdapter extends JsonWebhookAdapter {

    private static final Set<String> PAID_STATUSES = Set.of("paid", "paid_over");
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9A-F]{4})");

    private final FulfillmentProperties properties;
    private final ObjectMapper canonicalMapper;

    public HeleketGatewayAdapter(ObjectMapper objectMapper, OrderReferenceResolver resolver,
                                 FulfillmentProperties properties) {
        super(objectMapper, resolver);
        this.properties = properties;
        this.canonicalMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
                .configure(JsonGenerator.Feature.ESCAPE_NON_ASCII, true);
    }

    @Override
    public PaymentProviderType getProviderType() {
        return PaymentProviderType.HELEKET;
    }

    @Override
    public boolean verify(String rawPayload, HttpHeaders headers) {
        String apiKey = properties.getProviders().getHeleket().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.error("Heleket API key is not configured; rejecting delivery");
            return false;
        }
        Map<String, Object> body;
        try {
            body = canonicalMapper.readValue(rawPayload, new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (JsonProcessingException e) {
            log.warn("Heleket body is not a JSON object: {}", e.getOriginalMessage());
            return false;
        }
        Object sign = body.remove("sign");
        if (!(sign instanceof String)) {
            return false;
        }
        return WebhookSignatures.constantTimeEquals(sign(body, apiKey), (String) sign);
    }

    /** Signature over the given fields, as Heleket computes it. */
    String sign(Map<String, Object> fields, String apiKey) {
        String canonical;
        try {
            canonical = lowercaseEscapes(canonicalMapper.writeValueAsString(fields));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize Heleket fields", e);
        }
        String encoded = Base64.getEncoder().encodeToString(canonical.getBytes(StandardCharsets.UTF_8));
        return WebhookSignatures.md5Hex(encoded + apiKey);
    }

    @Override
    public CanonicalPaymentEvent parse(String rawPayload) {
        JsonNode root = readTree(rawPayload);
        String status = text(root, "status");
        Map<String, String> metadata = embeddedJson(text(root, "additional_data"));
        if (metadata.isEmpty()) {
            metadata = embeddedJson(text(root, "description"));
        }
        String reference = firstNonNull(text(root, "order_id"), metadata.get("payment_reference"), metadata.get("order_id"));
        return CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.HELEKET)
                .providerTransactionId(requiredText(root, "uuid"))
                .paymentConfirmed(status != null && PAID_STATUSES.contains(status))
                .providerStatus(status)
                .amount(decimal(root, "amount"))
                .currency(text(root, "currency"))
                .orderReference(reference)
                .buyerId(metadata.get(META_BUYER))
                .hostId(metadata.get(META_HOST))
                .metadata(metadata)
                .build();
    }

    private static String lowercaseEscapes(String json) {
        Matcher matcher = UNICODE_ESCAPE.matcher(json);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement("\\u" + matcher.group(1).toLowerCase()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
