package com.vpnshop.fulfillment.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vpnshop.fulfillment.domain.ProcessedWebhook;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * JSON codec for {@link ProcessedWebhook} markers. Plain JSON without type info; unknown
 * fields are ignored when reading.
 */
public class ProcessedWebhookRedisSerializer implements RedisSerializer<ProcessedWebhook> {

    private final ObjectMapper mapper;

    public ProcessedWebhookRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(ProcessedWebhook value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize ProcessedWebhook", e);
        }
    }

    @Override
    public ProcessedWebhook deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), ProcessedWebhook.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize ProcessedWebhook", e);
        }
    }
}
