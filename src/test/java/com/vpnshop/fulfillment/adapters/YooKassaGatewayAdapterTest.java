package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.MalformedPayloadException;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderResolution;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YooKassaGatewayAdapterTest {

    private static final String BODY = "{\"type\":\"notification\",\"event\":\"payment.succeeded\",\"object\":{"
            + "\"id\":\"2d8f1c3e-000f-5000-9000-1b2c3d4e5f60\",\"status\":\"succeeded\","
            + "\"amount\":{\"value\":\"199.00\",\"currency\":\"RUB\"},\"captured_at\":\"2026-03-01T10:15:30.000Z\","
            + "\"metadata\":{\"payment_reference\":\"pr-abc123\",\"user_id\":\"42\"}}}";
    // HMAC-SHA256(BODY) keyed with "yk-test-secret"
    private static final String SIGNATURE = "575256f9a05d4d918023641f452e45d2a7e4843987c91bf9dbaf13b28311f43a";

    @Mock
    private OrderReferenceResolver resolver;

    private YooKassaGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        FulfillmentProperties properties = new FulfillmentProperties();
        properties.getProviders().getYookassa().setWebhookSecret("yk-test-secret");
        adapter = new YooKassaGatewayAdapter(new ObjectMapper(), resolver, properties);
    }

    @Test
    void verifyAcceptsValidSignatureInAnyCase() {
        assertThat(adapter.verify(BODY, headers(SIGNATURE))).isTrue();
        assertThat(adapter.verify(BODY, headers(SIGNATURE.toUpperCase()))).isTrue();
    }

    @Test
    void verifyRejectsTamperedBodyAndMissingHeader() {
        assertThat(adapter.verify(BODY.replace("199.00", "1.00"), headers(SIGNATURE))).isFalse();
        assertThat(adapter.verify(BODY, new HttpHeaders())).isFalse();
    }

    @Test
    void verifyRejectsEverythingWhenSecretMissing() {
        YooKassaGatewayAdapter unconfigured = new YooKassaGatewayAdapter(new ObjectMapper(), resolver, new FulfillmentProperties());
        assertThat(unconfigured.verify(BODY, headers(SIGNATURE))).isFalse();
    }

    @Test
    void parseExtractsSucceededPayment() {
        CanonicalPaymentEvent event = adapter.parse(BODY);

        assertThat(event.getProvider()).isEqualTo(PaymentProviderType.YOOKASSA);
        assertThat(event.getProviderTransactionId()).isEqualTo("2d8f1c3e-000f-5000-9000-1b2c3d4e5f60");
        assertThat(event.isPaymentConfirmed()).isTrue();
        assertThat(event.getAmount()).isEqualByComparingTo("199.00");
        assertThat(event.getCurrency()).isEqualTo("RUB");
        assertThat(event.getOrderReference()).isEqualTo("pr-abc123");
        assertThat(event.getBuyerId()).isEqualTo("42");
        assertThat(event.getPaidAt()).isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
    }

    @Test
    void parseMarksWaitingForCaptureAsNotConfirmed() {
        CanonicalPaymentEvent event = adapter.parse(BODY
                .replace("payment.succeeded", "payment.waiting_for_capture")
                .replace("\"succeeded\"", "\"waiting_for_capture\""));
        assertThat(event.isPaymentConfirmed()).isFalse();
    }

    @Test
    void parseRejectsPayloadWithoutPaymentObject() {
        assertThatThrownBy(() -> adapter.parse("{\"event\":\"payment.succeeded\"}"))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> adapter.parse("not json"))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void resolveOrderUsesPaymentReference() {
        when(resolver.byReference("pr-abc123")).thenReturn(Optional.of("order-1"));

        OrderResolution resolution = adapter.resolveOrder(adapter.parse(BODY));

        assertThat(resolution.isMatched()).isTrue();
        assertThat(resolution.getOrderId()).isEqualTo("order-1");
    }

    @Test
    void resolveOrderFallsBackToBuyerHostAndPrice() {
        CanonicalPaymentEvent event = CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.YOOKASSA)
                .providerTransactionId("tx")
                .amount(new BigDecimal("199.00"))
                .buyerId("42")
                .hostId("nl-1")
                .metadata(java.util.Map.of("price", "199.00"))
                .build();
        when(resolver.byBuyerHostAmount("42", "nl-1", new BigDecimal("199.00"))).thenReturn(OrderResolution.matched("order-2"));

        assertThat(adapter.resolveOrder(event).getOrderId()).isEqualTo("order-2");
    }

    @Test
    void resolveOrderWithoutCorrelationDataIsOrphaned() {
        CanonicalPaymentEvent event = CanonicalPaymentEvent.builder()
                .provider(PaymentProviderType.YOOKASSA)
                .providerTransactionId("tx")
                .amount(BigDecimal.TEN)
                .build();
        assertThat(adapter.resolveOrder(event).isMatched()).isFalse();
    }

    private static HttpHeaders headers(String signature) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(YooKassaGatewayAdapter.SIGNATURE_HEADER, signature);
        return headers;
    }
}
