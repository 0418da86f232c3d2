package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.domain.PaymentEventOutcome;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ProcessedWebhook;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessedWebhookRedisSerializerTest {

    private final ProcessedWebhookRedisSerializer serializer = new ProcessedWebhookRedisSerializer();

    @Test
    void writesPlainJsonWithIsoTimestamps() {
        byte[] bytes = serializer.serialize(ProcessedWebhook.builder()
                .provider(PaymentProviderType.YOOKASSA)
                .providerTransactionId("tx-1")
                .orderId("order-1")
                .outcome(PaymentEventOutcome.CONFIRMED)
                .processedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .build());

        String json = new String(bytes, StandardCharsets.UTF_8);
        assertThat(json).contains("\"processedAt\":\"2026-03-01T12:00:00Z\"");
        assertThat(json).doesNotContain("@class");
    }

    @Test
    void ignoresUnknownFieldsWhenReading() {
        String json = "{\"provider\":\"CRYPTOBOT\",\"providerTransactionId\":\"inv-7\",\"orderId\":\"order-2\","
                + "\"outcome\":\"DUPLICATE\",\"processedAt\":\"2026-03-01T12:00:00Z\",\"extra\":42}";

        ProcessedWebhook marker = serializer.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(marker.getProvider()).isEqualTo(PaymentProviderType.CRYPTOBOT);
        assertThat(marker.getProviderTransactionId()).isEqualTo("inv-7");
        assertThat(marker.getOutcome()).isEqualTo(PaymentEventOutcome.DUPLICATE);
    }

    @Test
    void emptyValueReadsAsMissingAndGarbageFails() {
        assertThat(serializer.deserialize(new byte[0])).isNull();
        assertThatThrownBy(() -> serializer.deserialize("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SerializationException.class);
    }
}
