package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.domain.AmountMismatchException;
import com.vpnshop.fulfillment.domain.CanonicalPaymentEvent;
import com.vpnshop.fulfillment.domain.ConflictingPaymentException;
import com.vpnshop.fulfillment.domain.LatePaymentException;
import com.vpnshop.fulfillment.domain.PaymentEventOutcome;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.entity.ProvisioningRecordEntity;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Sequences the pipeline after each committed transition: payment confirmed, then
 * provisioning, then referral settlement and the buyer notice. Runs outside any
 * transaction; everything after the credential is issued is best effort and left
 * pending for the sweeps when it fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FulfillmentCoordinator {

    private final OrderStateMachine stateMachine;
    private final ProvisioningDispatcher dispatcher;
    private final ReferralLedger referralLedger;
    private final OrderNotifier notifier;
    private final OrderLedger ledger;
    private final ManualReviewQueue reviewQueue;
    private final AuditLogger auditLogger;

    public OrderEntity createOrder(CreateOrderCommand command) {
        try {
            return stateMachine.createOrder(command);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent create for buyerId={}, planId={}; returning the winner", command.getBuyerId(), command.getPlanId());
            return ledger.findByIdempotencyKey(OrderStateMachine.idempotencyKey(command)).orElseThrow(() -> e);
        }
    }

    /**
     * Applies a payment to the order and, when it confirms the order, provisions right away.
     * Rejections are already queued for review by the state machine; here the buyer is told.
     */
    public PaymentEventOutcome handleConfirmedPayment(String orderId, CanonicalPaymentEvent event) {
        OrderStateMachine.ConfirmationResult result;
        try {
            result = stateMachine.confirmPayment(orderId, event);
        } catch (AmountMismatchException e) {
            notifyQuietly(orderId, () -> notifier.paymentUnderReview(orderId, event));
            return PaymentEventOutcome.AMOUNT_MISMATCH;
        } catch (LatePaymentException e) {
            log.warn("Late payment: orderId={}, state={}, providerTxId={}", orderId, e.getState(), event.getProviderTransactionId());
            notifyQuietly(orderId, () -> notifier.paymentAfterExpiry(orderId, event));
            return PaymentEventOutcome.LATE_PAYMENT;
        } catch (ConflictingPaymentException e) {
            log.warn("Conflicting payment: orderId={}, recorded={}, incoming={}",
                    orderId, e.getRecordedTransactionId(), e.getIncomingTransactionId());
            return PaymentEventOutcome.CONFLICTING_PAYMENT;
        }
        if (result == OrderStateMachine.ConfirmationResult.ALREADY_CONFIRMED) {
            return PaymentEventOutcome.DUPLICATE;
        }
        provisionAndFinish(orderId);
        return PaymentEventOutcome.CONFIRMED;
    }

    /**
     * One provisioning attempt plus whatever follows it. Never throws: the payment is
     * already committed and the order stays due for the provisioning sweep.
     */
    public ProvisioningDispatcher.AttemptOutcome provisionAndFinish(String orderId) {
        ProvisioningDispatcher.AttemptOutcome outcome;
        try {
            outcome = dispatcher.attempt(orderId);
        } catch (RuntimeException e) {
            log.error("Provisioning attempt aborted for orderId={}; the sweep will retry", orderId, e);
            return ProvisioningDispatcher.AttemptOutcome.NOT_DUE;
        }
        if (outcome == ProvisioningDispatcher.AttemptOutcome.FULFILLED) {
            runSideEffects(orderId);
        } else if (outcome == ProvisioningDispatcher.AttemptOutcome.FAILED) {
            notifyQuietly(orderId, () -> notifier.sendPending(orderId));
        }
        return outcome;
    }

    public void runSideEffects(String orderId) {
        try {
            referralLedger.settle(orderId);
        } catch (RuntimeException e) {
            log.error("Referral settlement failed for orderId={}; left pending", orderId, e);
        }
        notifyQuietly(orderId, () -> notifier.sendPending(orderId));
    }

    /**
     * Operator refund. The ledger change commits first; removing the credential from the
     * host is best effort and a failure is queued for an operator.
     */
    public OrderEntity refund(String orderId, String note) {
        Optional<ProvisioningRecordEntity> revoked = stateMachine.refund(orderId, note);
        revoked.ifPresent(record -> {
            try {
                dispatcher.revoke(record.getHostId(), record.getRemoteCredentialId(), record.getClientReference());
                auditLogger.logCredentialRevoked(orderId, record.getHostId(), record.getRemoteCredentialId(), "REFUNDED");
            } catch (ProvisioningException e) {
                log.error("Remote revoke failed for orderId={}, hostId={}: {}", orderId, record.getHostId(), e.getMessage());
                reviewQueue.openDetached(ReviewReason.REVOKE_FAILED, "revoke:" + record.getRecordId(), null, null, orderId,
                        "Credential " + record.getRemoteCredentialId() + " on host " + record.getHostId()
                                + " still live after refund: " + e.getErrorCode());
            }
        });
        return ledger.getOrder(orderId);
    }

    private void notifyQuietly(String orderId, Runnable send) {
        try {
            send.run();
        } catch (RuntimeException e) {
            log.warn("Buyer notification failed for orderId={}: {}", orderId, e.getMessage());
        }
    }
}
