package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ProcessedWebhook;
import com.vpnshop.fulfillment.persistence.entity.PaymentEventEntity;
import com.vpnshop.fulfillment.persistence.repository.PaymentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Answers "was this provider transaction already processed?" without touching the
 * order tables. Redis first, payment_events as the persistent fallback; when both are
 * down it answers "no" and the ledger's own idempotency takes over.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDedupCache {

    private static final String KEY_PREFIX = "webhook:processed:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final RedisTemplate<String, ProcessedWebhook> redisTemplate;
    private final PaymentEventRepository eventRepository;

    public Optional<ProcessedWebhook> findProcessed(PaymentProviderType provider, String providerTransactionId) {
        String key = key(provider, providerTransactionId);
        try {
            ProcessedWebhook cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Dedup hit in Redis for key={}", key);
                return Optional.of(cached);
            }
        } catch (SerializationException e) {
            log.error("Dedup marker for key={} cannot be read; falling back to database", key, e);
        } catch (Exception e) {
            log.warn("Dedup cache read failed for key={} (Redis unavailable), falling back to database: {}",
                    key, e.getMessage());
        }

        try {
            Optional<PaymentEventEntity> entity =
                    eventRepository.findByProviderAndProviderTransactionId(provider, providerTransactionId);
            if (entity.isPresent() && entity.get().isProcessed()) {
                ProcessedWebhook marker = toMarker(entity.get());
                log.debug("Dedup hit in database for key={}, outcome={}", key, marker.getOutcome());
                store(marker);
                return Optional.of(marker);
            }
        } catch (Exception e) {
            log.error("Database dedup check failed for key={}: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    /** Best effort; a failed write only costs a database lookup on the next delivery. */
    public void store(ProcessedWebhook marker) {
        String key = key(marker.getProvider(), marker.getProviderTransactionId());
        try {
            redisTemplate.opsForValue().set(key, marker, DEFAULT_TTL);
            log.debug("Stored dedup marker for key={}", key);
        } catch (Exception e) {
            log.warn("Failed to store dedup marker for key={}: {}", key, e.getMessage());
        }
    }

    public static ProcessedWebhook toMarker(PaymentEventEntity entity) {
        return ProcessedWebhook.builder()
                .provider(entity.getProvider())
                .providerTransactionId(entity.getProviderTransactionId())
                .orderId(entity.getResolvedOrderId())
                .outcome(entity.getOutcome())
                .processedAt(entity.getProcessedAt())
                .build();
    }

    private static String key(PaymentProviderType provider, String providerTransactionId) {
        return KEY_PREFIX + provider.name().toLowerCase() + ":" + providerTransactionId;
    }
}
