package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.OrderNotFoundException;
import com.vpnshop.fulfillment.domain.OrderResolution;
import com.vpnshop.fulfillment.domain.PaymentEventOutcome;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ProcessedWebhook;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.PaymentEventEntity;
import com.vpnshop.fulfillment.persistence.entity.RejectedWebhookEntity;
import com.vpnshop.fulfillment.persistence.service.PaymentEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for provider callbacks. Verifies, normalizes and durably records each
 * delivery before any order logic runs, then drives the order synchronously. A
 * delivery that fails after it was recorded stays unprocessed for the provider's retry
 * or the re-drive sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngressService {

    private final GatewayRegistry gatewayRegistry;
    private final PaymentEventStore eventStore;
    private final WebhookDedupCache dedupCache;
    private final FulfillmentCoordinator coordinator;
    private final ManualReviewQueue reviewQueue;
    private final AuditLogger auditLogger;

    public IngestResult ingest(PaymentProviderType provider, String rawPayload, HttpHeaders headers) {
        String body = rawPayload != null ? rawPayload : "";
        String payloadHash = WebhookSignatures.sha256Hex(body);
        auditLogger.logWebhookReceived(provider, payloadHash);

        PaymentGatewayAdapter adapter = gatewayRegistry.find(provider)
                .orElseThrow(() -> new IllegalStateException("No gateway adapter for " + provider));

        boolean verified;
        try {
            verified = adapter.verify(body, headers);
        } catch (RuntimeException e) {
            log.warn("Verification error for provider={}: {}", provider, e.getMessage());
            verified = false;
        }
        if (!verified) {
            eventStore.recordRejected(provider, RejectedWebhookEntity.Reason.BAD_SIGNATURE, "signature verification failed", payloadHash);
            auditLogger.logWebhookRejected(provider, "BAD_SIGNATURE", payloadHash);
            return IngestResult.of(IngestOutcome.REJECTED, null, "signature verification failed");
        }

        CanonicalPaymentEvent event;
        try {
            event = adapter.parse(body);
        } catch (MalformedPayloadException e) {
            eventStore.recordRejected(provider, RejectedWebhookEntity.Reason.MALFORMED, e.getMessage(), payloadHash);
            auditLogger.logWebhookRejected(provider, "MALFORMED", payloadHash);
            return IngestResult.of(IngestOutcome.MALFORMED, null, e.getMessage());
        }
        if (!event.isPaymentConfirmed()) {
            log.info("Ignoring non-payment notification: provider={}, providerTxId={}, status={}",
                    provider, event.getProviderTransactionId(), event.getProviderStatus());
            return IngestResult.of(IngestOutcome.IGNORED, null, "status " + event.getProviderStatus());
        }

        Optional<ProcessedWebhook> marker = dedupCache.findProcessed(provider, event.getProviderTransactionId());
        if (marker.isPresent()) {
            log.info("Duplicate delivery: provider={}, providerTxId={}, outcome={}",
                    provider, event.getProviderTransactionId(), marker.get().getOutcome());
            return IngestResult.of(IngestOutcome.DUPLICATE, marker.get().getOrderId(), "already processed");
        }

        PaymentEventEntity stored;
        try {
            stored = eventStore.recordOrLoad(event, body, payloadHash);
        } catch (RuntimeException e) {
            log.error("Could not persist payment event provider={} providerTxId={}", provider, event.getProviderTransactionId(), e);
            return IngestResult.of(IngestOutcome.RETRY_LATER, null, "event not recorded");
        }
        if (stored.isProcessed()) {
            dedupCache.store(WebhookDedupCache.toMarker(stored));
            return IngestResult.of(IngestOutcome.DUPLICATE, stored.getResolvedOrderId(), "already processed");
        }
        return process(stored.getEventId(), event, adapter);
    }

    /** Processes a recorded but unprocessed event again from its stored payload. */
    public IngestResult redrive(String eventId) {
        PaymentEventEntity stored = eventStore.find(eventId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment event " + eventId));
        if (stored.isProcessed()) {
            return IngestResult.of(IngestOutcome.DUPLICATE, stored.getResolvedOrderId(), "already processed");
        }
        PaymentGatewayAdapter adapter = gatewayRegistry.find(stored.getProvider())
                .orElseThrow(() -> new IllegalStateException("No gateway adapter for " + stored.getProvider()));
        log.info("Re-driving payment event: eventId={}, provider={}, providerTxId={}, attempts={}",
                eventId, stored.getProvider(), stored.getProviderTransactionId(), stored.getAttempts());
        return process(eventId, adapter.parse(stored.getRawPayload()), adapter);
    }

    private IngestResult process(String eventId, CanonicalPaymentEvent event, PaymentGatewayAdapter adapter) {
        try {
            OrderResolution resolution = adapter.resolveOrder(event);
            if (!resolution.isMatched()) {
                return orphan(eventId, event, resolution.getReason());
            }
            String orderId = resolution.getOrderId();
            PaymentEventOutcome outcome;
            try {
                outcome = coordinator.handleConfirmedPayment(orderId, event);
            } catch (OrderNotFoundException e) {
                return orphan(eventId, event, "resolved order " + orderId + " does not exist");
            }
            eventStore.markProcessed(eventId, orderId, outcome);
            cacheMarker(eventId);
            log.info("Payment event processed: provider={}, providerTxId={}, orderId={}, outcome={}",
                    event.getProvider(), event.getProviderTransactionId(), orderId, outcome);
            return IngestResult.of(toIngestOutcome(outcome), orderId, outcome.name());
        } catch (RuntimeException e) {
            log.error("Payment event processing failed: eventId={}, provider={}, providerTxId={}",
                    eventId, event.getProvider(), event.getProviderTransactionId(), e);
            try {
                eventStore.markAttemptFailed(eventId, e);
            } catch (RuntimeException bookkeeping) {
                log.error("Could not record failed attempt for eventId={}", eventId, bookkeeping);
            }
            return IngestResult.of(IngestOutcome.RETRY_LATER, null, "processing failed");
        }
    }

    private IngestResult orphan(String eventId, CanonicalPaymentEvent event, String reason) {
        log.warn("Orphaned payment: provider={}, providerTxId={}, amount={} {}, reason={}",
                event.getProvider(), event.getProviderTransactionId(), event.getAmount(), event.getCurrency(), reason);
        reviewQueue.openDetached(ReviewReason.ORPHANED_PAYMENT,
                "orphan:" + event.getProvider() + ":" + event.getProviderTransactionId(),
                event.getProvider(), event.getProviderTransactionId(), null,
                reason + "; amount " + event.getAmount() + " " + event.getCurrency()
                        + ", reference " + event.getOrderReference());
        eventStore.markProcessed(eventId, null, PaymentEventOutcome.ORPHANED);
        cacheMarker(eventId);
        return IngestResult.of(IngestOutcome.ORPHANED, null, reason);
    }

    private void cacheMarker(String eventId) {
        eventStore.find(eventId).ifPresent(e -> dedupCache.store(WebhookDedupCache.toMarker(e)));
    }

    private static IngestOutcome toIngestOutcome(PaymentEventOutcome outcome) {
        switch (outcome) {
            case CONFIRMED:
                return IngestOutcome.ACCEPTED;
            case DUPLICATE:
                return IngestOutcome.DUPLICATE;
            case ORPHANED:
                return IngestOutcome.ORPHANED;
            default:
                return IngestOutcome.HELD_FOR_REVIEW;
        }
    }
}
