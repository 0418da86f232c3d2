package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import com.vpnshop.fulfillment.persistence.service.PaymentEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recovery passes over ledger state. Each pass reads at most one batch and handles every
 * item through the same locked operations a live request uses, so a sweep and a webhook
 * never both act on one order. A failing item is logged and left for the next pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FulfillmentSweeps {

    private final OrderLedger ledger;
    private final PaymentEventStore eventStore;
    private final OrderStateMachine stateMachine;
    private final FulfillmentCoordinator coordinator;
    private final ReferralLedger referralLedger;
    private final OrderNotifier notifier;
    private final WebhookIngressService ingressService;
    private final ProvisioningDispatcher dispatcher;
    private final ManualReviewQueue reviewQueue;
    private final AuditLogger auditLogger;
    private final FulfillmentProperties properties;
    private final Clock clock;

    public int expireStaleOrders() {
        Instant cutoff = clock.instant().minus(properties.getOrders().getPaymentTimeout());
        int expired = 0;
        for (String orderId : ledger.findStaleUnpaidOrderIds(cutoff, batchSize())) {
            try {
                if (stateMachine.expire(orderId)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Expiry failed for orderId={}", orderId, e);
            }
        }
        return expired;
    }

    public int retryProvisioning() {
        int attempted = 0;
        for (String orderId : ledger.findProvisioningDueOrderIds(batchSize())) {
            ProvisioningDispatcher.AttemptOutcome outcome = coordinator.provisionAndFinish(orderId);
            if (outcome != ProvisioningDispatcher.AttemptOutcome.NOT_DUE) {
                attempted++;
                log.info("Provisioning sweep: orderId={}, outcome={}", orderId, outcome);
            }
        }
        return attempted;
    }

    public int retrySettlements() {
        int settled = 0;
        for (String orderId : ledger.findSettlementPendingOrderIds(batchSize())) {
            try {
                referralLedger.settle(orderId);
                settled++;
            } catch (RuntimeException e) {
                log.error("Settlement retry failed for orderId={}", orderId, e);
            }
        }
        return settled;
    }

    public int retryNotifications() {
        int delivered = 0;
        for (String orderId : ledger.findNotificationPendingOrderIds(batchSize())) {
            try {
                notifier.sendPending(orderId);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Notification retry failed for orderId={}: {}", orderId, e.getMessage());
                deferNotification(orderId, e);
            }
        }
        return delivered;
    }

    public int redrivePaymentEvents() {
        Instant cutoff = clock.instant().minus(properties.getSweeps().getRedriveGrace());
        int processed = 0;
        for (String eventId : eventStore.findUnprocessedEventIds(cutoff, batchSize())) {
            try {
                IngestResult result = ingressService.redrive(eventId);
                if (result.getOutcome() != IngestOutcome.RETRY_LATER) {
                    processed++;
                    continue;
                }
            } catch (RuntimeException e) {
                log.error("Re-drive failed for eventId={}", eventId, e);
                recordRedriveFailure(eventId, e);
            }
            escalateIfStuck(eventId);
        }
        return processed;
    }

    /**
     * Reminds buyers as their credential approaches each configured mark (hours before
     * expiry). Each mark is sent at most once per expiry; a renewal clears the marks.
     */
    public int sendExpiryReminders() {
        List<Integer> marks = properties.getSweeps().getReminderHours().stream()
                .sorted()
                .collect(Collectors.toList());
        if (marks.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        Instant horizon = now.plus(Duration.ofHours(Collections.max(marks)));
        int sent = 0;
        for (ProvisioningRecordEntity record : ledger.findRecordsExpiringBefore(horizon, batchSize())) {
            long minutesLeft = Duration.between(now, record.getExpiresAt()).toMinutes();
            Optional<Integer> mark = marks.stream().filter(m -> minutesLeft <= m * 60L).findFirst();
            if (mark.isEmpty()) {
                continue;
            }
            Integer last = record.getLastReminderHours();
            if (last != null && last <= mark.get()) {
                continue;
            }
            try {
                notifier.expiryReminder(record, mark.get());
                ledger.markReminderSent(record.getRecordId(), mark.get());
                sent++;
            } catch (RuntimeException e) {
                log.warn("Expiry reminder failed for orderId={}: {}", record.getOrderId(), e.getMessage());
            }
        }
        return sent;
    }

    /**
     * Removes credentials from their hosts once they have been expired for the cleanup
     * grace period. Unreachable hosts are retried with backoff; a host that refuses the
     * removal, or keeps failing past the retry limit, leaves an operator item and the
     * record is closed anyway.
     */
    public int cleanupExpiredCredentials() {
        Instant cutoff = clock.instant().minus(properties.getSweeps().getCleanupGrace());
        int revoked = 0;
        for (ProvisioningRecordEntity record : ledger.findRecordsExpiredBefore(cutoff, batchSize())) {
            try {
                dispatcher.revoke(record.getHostId(), record.getRemoteCredentialId(), record.getClientReference());
                auditLogger.logCredentialRevoked(record.getOrderId(), record.getHostId(), record.getRemoteCredentialId(), "EXPIRED");
            } catch (ProvisioningException e) {
                if (e.isRetryable() && !cleanupRetriesExhausted(record)) {
                    log.warn("Cleanup deferred for orderId={}, hostId={}: {}", record.getOrderId(), record.getHostId(), e.getMessage());
                    continue;
                }
                openRevokeFailed(record, e.getErrorCode());
            } catch (RuntimeException e) {
                log.error("Cleanup failed for orderId={}", record.getOrderId(), e);
                if (!cleanupRetriesExhausted(record)) {
                    continue;
                }
                openRevokeFailed(record, e.getClass().getSimpleName());
            }
            ledger.markRecordRevoked(record.getRecordId(), "EXPIRED");
            revoked++;
        }
        return revoked;
    }

    /** Backs the order off after a failed delivery; past the retry limit an operator takes over. */
    private void deferNotification(String orderId, RuntimeException error) {
        try {
            int failures = ledger.recordNotificationFailure(orderId);
            if (failures < properties.getSweeps().getMaxRetries()) {
                return;
            }
            ledger.abandonNotifications(orderId);
            reviewQueue.openDetached(ReviewReason.NOTIFICATION_FAILED, "notify:" + orderId, null, null, orderId,
                    "Buyer notice undeliverable after " + failures + " attempts: " + error.getMessage());
            log.error("Giving up on buyer notice for orderId={} after {} attempts", orderId, failures);
        } catch (RuntimeException bookkeeping) {
            log.error("Could not record notification failure for orderId={}", orderId, bookkeeping);
        }
    }

    /** Backs the record off; true once it has failed often enough to hand to an operator. */
    private boolean cleanupRetriesExhausted(ProvisioningRecordEntity record) {
        try {
            return ledger.deferCleanup(record.getRecordId()) >= properties.getSweeps().getMaxRetries();
        } catch (RuntimeException bookkeeping) {
            log.error("Could not record cleanup failure for recordId={}", record.getRecordId(), bookkeeping);
            return false;
        }
    }

    private void openRevokeFailed(ProvisioningRecordEntity record, String cause) {
        reviewQueue.openDetached(ReviewReason.REVOKE_FAILED, "revoke:" + record.getRecordId(), null, null,
                record.getOrderId(), "Expired credential " + record.getRemoteCredentialId() + " on host "
                        + record.getHostId() + " could not be removed: " + cause);
    }

    private void recordRedriveFailure(String eventId, RuntimeException error) {
        try {
            eventStore.markAttemptFailed(eventId, error);
        } catch (RuntimeException bookkeeping) {
            log.error("Could not record re-drive failure for eventId={}", eventId, bookkeeping);
        }
    }

    /** Events still failing after the retry limit keep being re-driven and are also queued for an operator. */
    private void escalateIfStuck(String eventId) {
        try {
            eventStore.find(eventId)
                    .filter(event -> !event.isProcessed() && event.getAttempts() >= properties.getSweeps().getMaxRetries())
                    .ifPresent(event -> reviewQueue.openDetached(ReviewReason.REDRIVE_EXHAUSTED, "redrive:" + eventId,
                            event.getProvider(), event.getProviderTransactionId(), event.getResolvedOrderId(),
                            "Payment event still failing after " + event.getAttempts() + " attempts: " + event.getLastError()));
        } catch (RuntimeException e) {
            log.error("Could not check re-drive attempts for eventId={}", eventId, e);
        }
    }

    private int batchSize() {
        return properties.getSweeps().getBatchSize();
    }
}
