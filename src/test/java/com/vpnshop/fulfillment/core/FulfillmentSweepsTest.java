package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostRejectedException;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.PaymentEventEntity;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import com.vpnshop.fulfillment.persistence.service.PaymentEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FulfillmentSweepsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private OrderLedger ledger;
    @Mock
    private PaymentEventStore eventStore;
    @Mock
    private OrderStateMachine stateMachine;
    @Mock
    private FulfillmentCoordinator coordinator;
    @Mock
    private ReferralLedger referralLedger;
    @Mock
    private OrderNotifier notifier;
    @Mock
    private WebhookIngressService ingressService;
    @Mock
    private ProvisioningDispatcher dispatcher;
    @Mock
    private ManualReviewQueue reviewQueue;

    private FulfillmentProperties properties;
    private FulfillmentSweeps sweeps;

    @BeforeEach
    void setUp() {
        properties = new FulfillmentProperties();
        properties.getSweeps().setReminderHours(List.of(72, 24));
        sweeps = new FulfillmentSweeps(ledger, eventStore, stateMachine, coordinator, referralLedger, notifier,
                ingressService, dispatcher, reviewQueue, new AuditLogger(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void reminderUsesTightestReachedMark() {
        ProvisioningRecordEntity record = record("r-1", NOW.plus(Duration.ofHours(20)), null);
        when(ledger.findRecordsExpiringBefore(eq(NOW.plus(Duration.ofHours(72))), anyInt())).thenReturn(List.of(record));

        assertThat(sweeps.sendExpiryReminders()).isEqualTo(1);

        verify(notifier).expiryReminder(record, 24);
        verify(ledger).markReminderSent("r-1", 24);
    }

    @Test
    void reminderMarkIsSentOnce() {
        ProvisioningRecordEntity record = record("r-1", NOW.plus(Duration.ofHours(60)), 72);
        when(ledger.findRecordsExpiringBefore(any(), anyInt())).thenReturn(List.of(record));

        assertThat(sweeps.sendExpiryReminders()).isZero();
        verify(notifier, never()).expiryReminder(any(), anyInt());
    }

    @Test
    void failedReminderIsNotMarked() {
        ProvisioningRecordEntity record = record("r-1", NOW.plus(Duration.ofHours(70)), null);
        when(ledger.findRecordsExpiringBefore(any(), anyInt())).thenReturn(List.of(record));
        doThrow(new IllegalStateException("bot down")).when(notifier).expiryReminder(record, 72);

        assertThat(sweeps.sendExpiryReminders()).isZero();
        verify(ledger, never()).markReminderSent(anyString(), anyInt());
    }

    @Test
    void cleanupRevokesExpiredCredential() {
        ProvisioningRecordEntity record = record("r-1", NOW.minus(Duration.ofDays(6)), null);
        when(ledger.findRecordsExpiredBefore(eq(NOW.minus(Duration.ofDays(5))), anyInt())).thenReturn(List.of(record));

        assertThat(sweeps.cleanupExpiredCredentials()).isEqualTo(1);

        verify(dispatcher).revoke("nl-1", "remote-r-1", "o-r-1@nl-1");
        verify(ledger).markRecordRevoked("r-1", "EXPIRED");
    }

    @Test
    void cleanupLeavesRecordOpenWhileHostUnreachable() {
        ProvisioningRecordEntity record = record("r-1", NOW.minus(Duration.ofDays(6)), null);
        when(ledger.findRecordsExpiredBefore(any(), anyInt())).thenReturn(List.of(record));
        doThrow(new HostUnreachableException("nl-1", "timeout"))
                .when(dispatcher).revoke(anyString(), anyString(), anyString());

        assertThat(sweeps.cleanupExpiredCredentials()).isZero();
        verify(ledger, never()).markRecordRevoked(anyString(), anyString());
    }

    @Test
    void unreachableHostBacksCleanupOffThenHandsItToReview() {
        ProvisioningRecordEntity record = record("r-1", NOW.minus(Duration.ofDays(6)), null);
        when(ledger.findRecordsExpiredBefore(any(), anyInt())).thenReturn(List.of(record));
        doThrow(new HostUnreachableException("nl-1", "timeout"))
                .when(dispatcher).revoke(anyString(), anyString(), anyString());
        when(ledger.deferCleanup("r-1")).thenReturn(9, 10);

        assertThat(sweeps.cleanupExpiredCredentials()).isZero();
        verify(reviewQueue, never()).openDetached(any(), anyString(), any(), any(), any(), anyString());

        assertThat(sweeps.cleanupExpiredCredentials()).isEqualTo(1);
        verify(reviewQueue).openDetached(eq(ReviewReason.REVOKE_FAILED), eq("revoke:r-1"), isNull(), isNull(),
                eq("order-r-1"), anyString());
        verify(ledger).markRecordRevoked("r-1", "EXPIRED");
    }

    @Test
    void cleanupRefusedByHostGoesToReview() {
        ProvisioningRecordEntity record = record("r-1", NOW.minus(Duration.ofDays(6)), null);
        when(ledger.findRecordsExpiredBefore(any(), anyInt())).thenReturn(List.of(record));
        doThrow(new HostRejectedException("nl-1", "client not found in inbound"))
                .when(dispatcher).revoke(anyString(), anyString(), anyString());

        assertThat(sweeps.cleanupExpiredCredentials()).isEqualTo(1);

        verify(reviewQueue).openDetached(eq(ReviewReason.REVOKE_FAILED), eq("revoke:r-1"), isNull(), isNull(),
                eq("order-r-1"), anyString());
        verify(ledger).markRecordRevoked("r-1", "EXPIRED");
    }

    @Test
    void expirySweepCountsOnlyExpiredOrders() {
        when(ledger.findStaleUnpaidOrderIds(eq(NOW.minus(Duration.ofHours(1))), anyInt()))
                .thenReturn(List.of("o-1", "o-2"));
        when(stateMachine.expire("o-1")).thenReturn(true);
        when(stateMachine.expire("o-2")).thenReturn(false);

        assertThat(sweeps.expireStaleOrders()).isEqualTo(1);
    }

    @Test
    void redriveSkipsEventsInsideGracePeriod() {
        when(eventStore.findUnprocessedEventIds(eq(NOW.minus(Duration.ofMinutes(2))), anyInt()))
                .thenReturn(List.of("evt-1"));
        when(ingressService.redrive("evt-1")).thenReturn(IngestResult.of(IngestOutcome.ACCEPTED, "order-1", null));

        assertThat(sweeps.redrivePaymentEvents()).isEqualTo(1);
    }

    @Test
    void failedNoticeBacksOffUntilRetryLimit() {
        when(ledger.findNotificationPendingOrderIds(anyInt())).thenReturn(List.of("o-1", "o-2"));
        doThrow(new IllegalStateException("bot down")).when(notifier).sendPending("o-1");
        when(ledger.recordNotificationFailure("o-1")).thenReturn(3);

        assertThat(sweeps.retryNotifications()).isEqualTo(1);

        verify(notifier).sendPending("o-2");
        verify(ledger, never()).abandonNotifications(anyString());
        verify(reviewQueue, never()).openDetached(any(), anyString(), any(), any(), any(), anyString());
    }

    @Test
    void noticeFailingPastRetryLimitIsAbandonedToReview() {
        when(ledger.findNotificationPendingOrderIds(anyInt())).thenReturn(List.of("o-1"));
        doThrow(new IllegalStateException("bot down")).when(notifier).sendPending("o-1");
        when(ledger.recordNotificationFailure("o-1")).thenReturn(10);

        assertThat(sweeps.retryNotifications()).isZero();

        verify(ledger).abandonNotifications("o-1");
        verify(reviewQueue).openDetached(eq(ReviewReason.NOTIFICATION_FAILED), eq("notify:o-1"), isNull(), isNull(),
                eq("o-1"), anyString());
    }

    @Test
    void redriveFailureIsRecordedAndEscalatedPastRetryLimit() {
        when(eventStore.findUnprocessedEventIds(any(), anyInt())).thenReturn(List.of("evt-1"));
        IllegalStateException failure = new IllegalStateException("unparseable");
        when(ingressService.redrive("evt-1")).thenThrow(failure);
        when(eventStore.find("evt-1")).thenReturn(Optional.of(PaymentEventEntity.builder()
                .eventId("evt-1")
                .provider(PaymentProviderType.YOOKASSA)
                .providerTransactionId("tx-1")
                .attempts(10)
                .lastError("IllegalStateException: unparseable")
                .build()));

        assertThat(sweeps.redrivePaymentEvents()).isZero();

        verify(eventStore).markAttemptFailed("evt-1", failure);
        verify(reviewQueue).openDetached(eq(ReviewReason.REDRIVE_EXHAUSTED), eq("redrive:evt-1"),
                eq(PaymentProviderType.YOOKASSA), eq("tx-1"), isNull(), anyString());
    }

    @Test
    void redriveStillRetryingStaysOutOfReview() {
        when(eventStore.findUnprocessedEventIds(any(), anyInt())).thenReturn(List.of("evt-1"));
        when(ingressService.redrive("evt-1")).thenReturn(IngestResult.of(IngestOutcome.RETRY_LATER, null, "processing failed"));
        when(eventStore.find("evt-1")).thenReturn(Optional.of(PaymentEventEntity.builder()
                .eventId("evt-1").provider(PaymentProviderType.YOOKASSA).providerTransactionId("tx-1").attempts(2).build()));

        assertThat(sweeps.redrivePaymentEvents()).isZero();

        verify(eventStore, never()).markAttemptFailed(anyString(), any());
        verify(reviewQueue, never()).openDetached(any(), anyString(), any(), any(), any(), anyString());
    }

    private static ProvisioningRecordEntity record(String id, Instant expiresAt, Integer lastReminderHours) {
        return ProvisioningRecordEntity.builder()
                .recordId(id)
                .orderId("order-" + id)
                .buyerId("42")
                .hostId("nl-1")
                .remoteCredentialId("remote-" + id)
                .clientReference("o-" + id + "@nl-1")
                .issuedAt(NOW.minus(Duration.ofDays(30)))
                .expiresAt(expiresAt)
                .lastReminderHours(lastReminderHours)
                .build();
    }
}
