package com.vpnshop.fulfillment.compliance;

import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.ReferralCreditEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the money and credential trail as {@code [AUDIT]} log lines: every webhook
 * verdict, order transition, credential issue/revoke and referral credit. Log shipping
 * routes these lines to the audit index.
 */
@Slf4j
@Component
public class AuditLogger {

    public void logWebhookReceived(PaymentProviderType provider, String payloadHash) {
        log.info("[AUDIT] WEBHOOK_RECEIVED provider={} payloadHash={}", provider, payloadHash);
    }

    public void logWebhookRejected(PaymentProviderType provider, String reason, String payloadHash) {
        log.warn("[AUDIT] WEBHOOK_REJECTED provider={} reason={} payloadHash={}", provider, reason, payloadHash);
    }

    public void logTransition(String orderId, OrderState from, OrderState to, String cause) {
        log.info("[AUDIT] ORDER_TRANSITION orderId={} from={} to={} cause={}", orderId, from, to, cause);
    }

    public void logPaymentRecorded(String orderId, PaymentProviderType provider, String providerTxId,
                                   Object amount, String currency) {
        log.info("[AUDIT] PAYMENT_RECORDED orderId={} provider={} providerTxId={} amount={} currency={}",
                orderId, provider, providerTxId, amount, currency);
    }

    public void logCredentialIssued(String orderId, ProvisioningResult result) {
        log.info("[AUDIT] CREDENTIAL_ISSUED orderId={} hostId={} remoteId={} client={} expiresAt={} reused={}",
                orderId,
                result.getHostId(),
                result.getRemoteCredentialId(),
                SecretMasker.maskClientReference(result.getClientReference()),
                result.getExpiresAt(),
                result.isReusedExisting());
    }

    public void logCredentialRevoked(String orderId, String hostId, String remoteId, String reason) {
        log.info("[AUDIT] CREDENTIAL_REVOKED orderId={} hostId={} remoteId={} reason={}", orderId, hostId, remoteId, reason);
    }

    public void logReferralCredit(ReferralCreditEntity credit) {
        log.info("[AUDIT] REFERRAL_CREDIT referrerId={} orderId={} kind={} amount={} currency={}",
                credit.getReferrerId(),
                credit.getSourceOrderId(),
                credit.getKind(),
                credit.getAmount(),
                credit.getCurrencyCode());
    }

    public void logReviewOpened(ReviewReason reason, String dedupKey, String orderId) {
        log.warn("[AUDIT] REVIEW_OPENED reason={} key={} orderId={}", reason, dedupKey, orderId);
    }
}
