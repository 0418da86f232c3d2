package com.vpnshop.fulfillment.adapters;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.NotificationDeliveryException;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TelegramBotNotifierTest {

    private static final String SEND_URL = "http://telegram.test/botTOKEN/sendMessage";

    private MockRestServiceServer server;
    private FulfillmentProperties properties;
    private TelegramBotNotifier notifier;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new FulfillmentProperties();
        properties.getNotification().setBotToken("TOKEN");
        properties.getNotification().setApiUrl("http://telegram.test");
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        notifier = new TelegramBotNotifier(restTemplate, retryRegistry, properties);
    }

    @Test
    void sendsMessageToBuyerChat() {
        server.expect(requestTo(SEND_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.chat_id").value("42"))
                .andExpect(jsonPath("$.text").value("Your key is ready"))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        notifier.notify("42", "Your key is ready", Map.of("orderId", "order-1"));

        server.verify();
    }

    @Test
    void retriesThenSurfacesDeliveryFailure() {
        server.expect(ExpectedCount.times(2), requestTo(SEND_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> notifier.notify("42", "hello", Map.of()))
                .isInstanceOf(NotificationDeliveryException.class);
        server.verify();
    }

    @Test
    void disabledNotificationsSendNothing() {
        properties.getNotification().setEnabled(false);

        notifier.notify("42", "hello", Map.of());

        server.verify();
    }
}
