package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.OrderReferenceResolver;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class HeleketGatewayAdapterTest {

    // Signed with "heleket-test-key"; the description holds non-ASCII text
    private static final String BODY = "{\"type\": \"payment\", \"uuid\": \"62f88b36-a9d5-4fa6-aa26-e040c3dbf26d\", "
            + "\"order_id\": \"pr-ghi789\", \"amount\": \"199.00\", \"payment_amount\": \"199.00\", "
            + "\"merchant_amount\": \"195.02\", \"currency\": \"RUB\", \"status\": \"paid\", "
            + "\"additional_data\": \"{\\\"user_id\\\":\\\"42\\\",\\\"host_name\\\":\\\"nl-1\\\"}\", "
            + "\"description\": \"Подписка\", \"sign\": \"1c20648a1811f018b0cb174ef041d6d7\"}";

    private HeleketGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        FulfillmentProperties properties = new FulfillmentProperties();
        properties.getProviders().getHeleket().setApiKey("heleket-test-key");
        adapter = new HeleketGatewayAdapter(new ObjectMapper(), mock(OrderReferenceResolver.class), properties);
    }

    @Test
    void verifyAcceptsBodySignature() {
        assertThat(adapter.verify(BODY, new HttpHeaders())).isTrue();
    }

    @Test
    void verifyRejectsTamperedField() {
        assertThat(adapter.verify(BODY.replace("\"status\": \"paid\"", "\"status\": \"paid_over\""), new HttpHeaders())).isFalse();
    }

    @Test
    void verifyRejectsMissingSign() {
        assertThat(adapter.verify("{\"uuid\":\"x\",\"status\":\"paid\"}", new HttpHeaders())).isFalse();
        assertThat(adapter.verify("[]", new HttpHeaders())).isFalse();
    }

    @Test
    void parseReadsInvoiceAndEmbeddedMetadata() {
        CanonicalPaymentEvent event = adapter.parse(BODY);

        assertThat(event.getProviderTransactionId()).isEqualTo("62f88b36-a9d5-4fa6-aa26-e040c3dbf26d");
        assertThat(event.isPaymentConfirmed()).isTrue();
        assertThat(event.getAmount()).isEqualByComparingTo("199.00");
        assertThat(event.getCurrency()).isEqualTo("RUB");
        assertThat(event.getOrderReference()).isEqualTo("pr-ghi789");
        assertThat(event.getBuyerId()).isEqualTo("42");
        assertThat(event.getHostId()).isEqualTo("nl-1");
    }

    @Test
    void onlyPaidStatusesConfirm() {
        assertThat(adapter.parse(BODY.replace("\"status\": \"paid\"", "\"status\": \"paid_over\"")).isPaymentConfirmed()).isTrue();
        assertThat(adapter.parse(BODY.replace("\"status\": \"paid\"", "\"status\": \"wrong_amount\"")).isPaymentConfirmed()).isFalse();
        assertThat(adapter.parse(BODY.replace("\"status\": \"paid\"", "\"status\": \"check\"")).isPaymentConfirmed()).isFalse();
    }
}
