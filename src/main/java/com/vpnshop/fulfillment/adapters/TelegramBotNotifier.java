package com.vpnshop.fulfillment.adapters;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.NotificationDispatcher;
import com.vpnshop.fulfillment.domain.NotificationDeliveryException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Delivers buyer messages through the Telegram Bot API. Buyer ids are Telegram chat ids.
 * Transient failures are retried via the "notification" Resilience4j instance; whatever
 * is still failing afterwards surfaces as {@link NotificationDeliveryException} so the
 * order keeps its pending flag for the sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramBotNotifier implements NotificationDispatcher {

    private static final String RETRY_INSTANCE = "notification";

    private final RestTemplate restTemplate;
    private final RetryRegistry retryRegistry;
    private final FulfillmentProperties properties;

    @Override
    public void notify(String buyerId, String message, Map<String, Object> payload) {
        FulfillmentProperties.Notification config = properties.getNotification();
        if (!config.isEnabled()) {
            log.info("Notifications disabled; dropping message for buyer {} (payload keys {})", buyerId,
                    payload == null ? "[]" : payload.keySet());
            return;
        }
        if (config.getBotToken() == null || config.getBotToken().isBlank()) {
            throw new NotificationDeliveryException("Bot token not configured", null);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", buyerId);
        body.put("text", message);
        body.put("disable_web_page_preview", true);
        String url = config.getApiUrl() + "/bot" + config.getBotToken() + "/sendMessage";

        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<ResponseEntity<String>> send = Retry.decorateSupplier(retry,
                () -> restTemplate.postForEntity(url, body, String.class));
        try {
            ResponseEntity<String> response = send.get();
            log.debug("Telegram accepted message for buyer {}: status={}", buyerId, response.getStatusCode());
        } catch (RestClientException e) {
            log.warn("Telegram delivery failed for buyer {}: {}", buyerId, e.getMessage());
            throw new NotificationDeliveryException("Telegram delivery failed for buyer " + buyerId, e);
        }
    }
}
