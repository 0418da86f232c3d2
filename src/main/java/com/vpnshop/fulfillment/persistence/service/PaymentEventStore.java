package com.vpnshop.fulfillment.persistence.service;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.PaymentEventOutcome;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.PaymentEventEntity;
import com.vpnshop.fulfillment.persistence.entity.RejectedWebhookEntity;
import com.vpnshop.fulfillment.persistence.repository.PaymentEventRepository;
import com.vpnshop.fulfillment.persistence.repository.RejectedWebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists inbound payment events and boundary rejections. The unique
 * (provider, provider_transaction_id) constraint is the dedup authority.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentEventStore {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final PaymentEventRepository eventRepository;
    private final RejectedWebhookRepository rejectedRepository;
    private final FulfillmentProperties properties;
    private final Clock clock;

    /**
     * Inserts the event, or returns the row already stored for the same provider transaction.
     * Runs outside any caller transaction so a losing concurrent insert can reload the winner.
     */
    public PaymentEventEntity recordOrLoad(CanonicalPaymentEvent event, String rawPayload, String payloadHash) {
        Optional<PaymentEventEntity> existing = eventRepository.findByProviderAndProviderTransactionId(
                event.getProvider(), event.getProviderTransactionId());
        if (existing.isPresent()) {
            return existing.get();
        }
        PaymentEventEntity entity = PaymentEventEntity.builder()
                .eventId(UUID.randomUUID().toString())
                .provider(event.getProvider())
                .providerTransactionId(event.getProviderTransactionId())
                .amount(event.getAmount())
                .currencyCode(event.getCurrency())
                .orderReference(event.getOrderReference())
                .rawPayload(rawPayload)
                .payloadHash(payloadHash)
                .receivedAt(clock.instant())
                .processed(false)
                .attempts(0)
                .build();
        try {
            PaymentEventEntity saved = eventRepository.saveAndFlush(entity);
            log.debug("Persisted payment event: eventId={}, provider={}, providerTxId={}",
                    saved.getEventId(), saved.getProvider(), saved.getProviderTransactionId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent delivery of provider={} providerTxId={} already persisted; reusing stored event",
                    event.getProvider(), event.getProviderTransactionId());
            return eventRepository.findByProviderAndProviderTransactionId(
                            event.getProvider(), event.getProviderTransactionId())
                    .orElseThrow(() -> e);
        }
    }

    @Transactional
    public void markProcessed(String eventId, String orderId, PaymentEventOutcome outcome) {
        PaymentEventEntity entity = eventRepository.findById(eventId)
                .orElseThrow(() -> new IllegalStateException("Payment event vanished: " + eventId));
        if (entity.isProcessed()) {
            log.debug("Payment event {} already processed with outcome={}", eventId, entity.getOutcome());
            return;
        }
        entity.setProcessed(true);
        entity.setProcessedAt(clock.instant());
        entity.setResolvedOrderId(orderId);
        entity.setOutcome(outcome);
        entity.setAttempts(entity.getAttempts() + 1);
        entity.setLastError(null);
        entity.setNextAttemptAt(null);
    }

    /** Records the failure and holds the event back from the re-drive sweep for a growing delay. */
    @Transactional
    public void markAttemptFailed(String eventId, Throwable error) {
        eventRepository.findById(eventId).ifPresent(entity -> {
            int attempts = entity.getAttempts() + 1;
            entity.setAttempts(attempts);
            entity.setLastError(truncate(error.getClass().getSimpleName() + ": " + error.getMessage()));
            entity.setNextAttemptAt(clock.instant().plus(properties.getSweeps().retryDelay(attempts)));
        });
    }

    /** Boundary rejections are logged even when this write fails; they are never re-driven. */
    @Transactional
    public void recordRejected(PaymentProviderType provider, RejectedWebhookEntity.Reason reason,
                               String detail, String payloadHash) {
        try {
            rejectedRepository.save(RejectedWebhookEntity.builder()
                    .rejectionId(UUID.randomUUID().toString())
                    .provider(provider)
                    .reason(reason)
                    .detail(detail != null && detail.length() > 500 ? detail.substring(0, 500) : detail)
                    .payloadHash(payloadHash)
                    .receivedAt(clock.instant())
                    .build());
        } catch (Exception e) {
            log.error("Failed to persist rejected webhook provider={} reason={} payloadHash={}",
                    provider, reason, payloadHash, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEventEntity> find(String eventId) {
        return eventRepository.findById(eventId);
    }

    @Transactional(readOnly = true)
    public List<String> findUnprocessedEventIds(Instant receivedBefore, int limit) {
        return eventRepository.findUnprocessedEventIds(receivedBefore, clock.instant(), PageRequest.of(0, limit));
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
