package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.core.MalformedPayloadException;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.core.PaymentGatewayAdapter;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderResolution;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Shared JSON handling and correlation for providers that post JSON bodies. Subclasses
 * map their own field names; correlation prefers an echoed reference and falls back to
 * the buyer/host/price metadata older invoices carried.
 */
@Slf4j
abstract class JsonWebhookAdapter implements PaymentGatewayAdapter {

    static final String META_BUYER = "user_id";
    static final String META_HOST = "host_name";
    static final String META_PRICE = "price";

    protected final ObjectMapper objectMapper;
    protected final OrderReferenceResolver resolver;

    protected JsonWebhookAdapter(ObjectMapper objectMapper, OrderReferenceResolver resolver) {
        this.objectMapper = objectMapper;
        this.resolver = resolver;
    }

    @Override
    public OrderResolution resolveOrder(CanonicalPaymentEvent event) {
        if (event.getOrderReference() != null) {
            Optional<String> orderId = resolver.byReference(event.getOrderReference());
            if (orderId.isPresent()) {
                return OrderResolution.matched(orderId.get());
            }
        }
        Map<String, String> metadata = event.getMetadata() != null ? event.getMetadata() : Map.of();
        if (event.getBuyerId() != null && event.getHostId() != null) {
            BigDecimal price = decimalOrNull(metadata.get(META_PRICE));
            return resolver.byBuyerHostAmount(event.getBuyerId(), event.getHostId(), price != null ? price : event.getAmount());
        }
        return OrderResolution.orphaned(event.getOrderReference() != null
                ? "reference " + event.getOrderReference() + " matches no order"
                : "payment carries no order reference");
    }

    protected JsonNode readTree(String rawPayload) {
        try {
            JsonNode root = objectMapper.readTree(rawPayload);
            if (root == null || !root.isObject()) {
                throw new MalformedPayloadException(getProviderType() + " payload is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(getProviderType() + " payload is not valid JSON", e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    protected String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            throw new MalformedPayloadException(getProviderType() + " payload has no " + field);
        }
        return value;
    }

    protected BigDecimal decimal(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        BigDecimal parsed = decimalOrNull(value);
        if (parsed == null) {
            throw new MalformedPayloadException(getProviderType() + " field " + field + " is not a number: " + value);
        }
        return parsed;
    }

    protected static BigDecimal decimalOrNull(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static Instant instantOrNull(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Flattens a JSON object of scalars into string metadata; nested values are skipped. */
    protected static Map<String, String> flatten(JsonNode node) {
        Map<String, String> result = new HashMap<>();
        if (node == null || !node.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                result.put(field.getKey(), field.getValue().asText());
            }
        }
        return result;
    }

    /** Metadata sometimes arrives as a JSON string inside a string field. */
    protected Map<String, String> embeddedJson(String value) {
        if (value == null || !value.trim().startsWith("{")) {
            return new HashMap<>();
        }
        try {
            return flatten(objectMapper.readTree(value));
        } catch (JsonProcessingException e) {
            log.debug("{} metadata string is not JSON: {}", getProviderType(), e.getOriginalMessage());
            return new HashMap<>();
        }
    }

    protected static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
