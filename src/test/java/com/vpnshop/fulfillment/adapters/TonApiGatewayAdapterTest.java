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
import org.springframework.http.HttpHeaders;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TonApiGatewayAdapterTest {

    private static final String BODY = """
            {
              "account_id": "0:abc",
              "tx_id": "e3b0c442",
              "txs": [
                {"hash": "other", "utime": 1767225600},
                {"hash": "e3b0c442", "utime": 1772360130,
                 "in_msg": {"value": "1500000000", "decoded_comment": "pr-ton001"}}
              ],
              "in_progress_txs": [
                {"hash": "pending", "in_msg": {"value": "999000000000"}}
              ]
            }
            """;

    private OrderReferenceResolver resolver;
    private TonApiGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        FulfillmentProperties properties = new FulfillmentProperties();
        properties.getProviders().getTonapi().setWebhookToken("tonapi-test-token");
        properties.getProviders().getTonapi().setMatchWindow(Duration.ofMinutes(30));
        resolver = mock(OrderReferenceResolver.class);
        adapter = new TonApiGatewayAdapter(new ObjectMapper(), resolver, properties);
    }

    @Test
    void verifyChecksBearerToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("tonapi-test-token");
        assertThat(adapter.verify(BODY, headers)).isTrue();

        headers.setBearerAuth("wrong");
        assertThat(adapter.verify(BODY, headers)).isFalse();
        assertThat(adapter.verify(BODY, new HttpHeaders())).isFalse();
    }

    @Test
    void parseConvertsNanotonAndIgnoresPendingTransfers() {
        CanonicalPaymentEvent event = adapter.parse(BODY);

        assertThat(event.getProviderTransactionId()).isEqualTo("e3b0c442");
        assertThat(event.getAmount()).isEqualByComparingTo("1.5");
        assertThat(event.getCurrency()).isEqualTo("TON");
        assertThat(event.getOrderReference()).isEqualTo("pr-ton001");
        assertThat(event.getPaidAt()).isEqualTo(Instant.ofEpochSecond(1772360130L));
        assertThat(event.isPaymentConfirmed()).isTrue();
    }

    @Test
    void parseWithoutCommittedTransferIsNotConfirmed() {
        CanonicalPaymentEvent event = adapter.parse("{\"tx_id\":\"abc\",\"txs\":[]}");
        assertThat(event.isPaymentConfirmed()).isFalse();
        assertThat(event.getAmount()).isNull();
    }

    @Test
    void parseRequiresTxId() {
        assertThatThrownBy(() -> adapter.parse("{\"txs\":[]}")).isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void resolveFallsBackToAmountWindowWhenCommentUnknown() {
        CanonicalPaymentEvent event = adapter.parse(BODY);
        when(resolver.byReference("pr-ton001")).thenReturn(Optional.empty());
        when(resolver.byAmountWindow(PaymentProviderType.TONAPI, "TON", event.getAmount(), event.getPaidAt(), Duration.ofMinutes(30)))
                .thenReturn(OrderResolution.matched("order-ton"));

        assertThat(adapter.resolveOrder(event).getOrderId()).isEqualTo("order-ton");
        verify(resolver).byAmountWindow(PaymentProviderType.TONAPI, "TON", new BigDecimal("1.5"), event.getPaidAt(), Duration.ofMinutes(30));
    }
}
