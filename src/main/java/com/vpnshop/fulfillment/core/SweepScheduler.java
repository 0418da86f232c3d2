package com.vpnshop.fulfillment.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay triggers for {@link FulfillmentSweeps}. Disable with
 * {@code fulfillment.sweeps.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fulfillment.sweeps.enabled", havingValue = "true", matchIfMissing = true)
public class SweepScheduler {

    private final FulfillmentSweeps sweeps;

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.expiry-interval:PT1M}")
    public void expireStaleOrders() {
        report("expiry", sweeps.expireStaleOrders());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.provisioning-interval:PT15S}")
    public void retryProvisioning() {
        report("provisioning", sweeps.retryProvisioning());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.settlement-interval:PT1M}")
    public void retrySettlements() {
        report("settlement", sweeps.retrySettlements());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.notification-interval:PT30S}")
    public void retryNotifications() {
        report("notification", sweeps.retryNotifications());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.redrive-interval:PT1M}")
    public void redrivePaymentEvents() {
        report("payment re-drive", sweeps.redrivePaymentEvents());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.reminder-interval:PT10M}")
    public void sendExpiryReminders() {
        report("expiry reminder", sweeps.sendExpiryReminders());
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeps.cleanup-interval:PT1H}")
    public void cleanupExpiredCredentials() {
        report("credential cleanup", sweeps.cleanupExpiredCredentials());
    }

    private static void report(String sweep, int handled) {
        if (handled > 0) {
            log.info("Sweep {} handled {} item(s)", sweep, handled);
        } else {
            log.debug("Sweep {} found nothing to do", sweep);
        }
    }
}
