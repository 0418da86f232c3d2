package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostRejectedException;
import com.vpnshop.fulfillment.domain.HostUnavailableException;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Runs host calls for orders. Each host gets its own bulkhead (callers queue for a
 * free slot) and circuit breaker, so one slow panel never holds up another. The order
 * is claimed and settled by {@link OrderStateMachine} on either side of the call; no
 * transaction or lock is held while the host is talking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProvisioningDispatcher {

    private static final String INSTANCE_PREFIX = "host-";

    private final OrderStateMachine stateMachine;
    private final HostRegistry hostRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final FulfillmentProperties properties;

    public enum AttemptOutcome {
        NOT_DUE,
        FULFILLED,
        RETRY_SCHEDULED,
        FAILED
    }

    /**
     * One provisioning attempt for the order if one is due. Classified host failures are
     * folded into the order's retry schedule; anything else propagates and leaves the
     * claim to expire so a sweep picks the order up again.
     */
    public AttemptOutcome attempt(String orderId) {
        Optional<ProvisioningRequest> claimed = stateMachine.beginProvisioningAttempt(orderId);
        if (claimed.isEmpty()) {
            log.debug("No provisioning attempt due for orderId={}", orderId);
            return AttemptOutcome.NOT_DUE;
        }
        ProvisioningRequest request = claimed.get();
        ProvisioningResult result;
        try {
            result = callHost(request.getHostId(), (client, host) -> client.issueCredential(host, request));
        } catch (ProvisioningException e) {
            log.warn("Provisioning call failed: orderId={}, hostId={}, error={}, message={}",
                    orderId, request.getHostId(), e.getErrorCode(), e.getMessage());
            OrderStateMachine.FailureOutcome outcome = stateMachine.failProvisioningAttempt(orderId, e);
            switch (outcome) {
                case FAILED:
                    return AttemptOutcome.FAILED;
                case RETRY_SCHEDULED:
                    return AttemptOutcome.RETRY_SCHEDULED;
                default:
                    return AttemptOutcome.NOT_DUE;
            }
        }
        log.info("Credential issued: orderId={}, hostId={}, remoteId={}, expiresAt={}, reused={}",
                orderId, result.getHostId(), result.getRemoteCredentialId(), result.getExpiresAt(), result.isReusedExisting());
        return stateMachine.completeProvisioning(orderId, result) ? AttemptOutcome.FULFILLED : AttemptOutcome.NOT_DUE;
    }

    /** Removes a credential from its host under the same per-host limits as issuing. */
    public void revoke(String hostId, String remoteCredentialId, String clientReference) {
        callHost(hostId, (client, host) -> {
            client.revokeCredential(host, remoteCredentialId, clientReference);
            return null;
        });
    }

    private <T> T callHost(String hostId, BiFunction<HostProvisioningClient, FulfillmentProperties.Host, T> call) {
        FulfillmentProperties.Host host;
        try {
            host = hostRegistry.getHost(hostId);
        } catch (HostUnavailableException e) {
            throw new HostRejectedException(hostId, "Host " + hostId + " is no longer configured", e);
        }
        if (!hostRegistry.isHealthy(hostId)) {
            throw new HostUnreachableException(hostId, "Host " + hostId + " is flagged unhealthy");
        }
        HostProvisioningClient client = hostRegistry.clientFor(host);

        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(INSTANCE_PREFIX + hostId);
        Bulkhead bulkhead = bulkheadRegistry.bulkhead(INSTANCE_PREFIX + hostId, BulkheadConfig.custom()
                .maxConcurrentCalls(host.getMaxConcurrentCalls())
                .maxWaitDuration(properties.getProvisioning().getQueueWait())
                .build());
        Supplier<T> supplier = () -> call.apply(client, host);
        Supplier<T> withCb = CircuitBreaker.decorateSupplier(cb, supplier);
        Supplier<T> withBulkhead = Bulkhead.decorateSupplier(bulkhead, withCb);

        try {
            return withBulkhead.get();
        } catch (ProvisioningException e) {
            throw e;
        } catch (CallNotPermittedException e) {
            throw new HostUnreachableException(hostId, "Circuit open for host " + hostId, e);
        } catch (BulkheadFullException e) {
            throw new HostUnreachableException(hostId, "No free call slot for host " + hostId + " within queue wait", e);
        } catch (RuntimeException e) {
            log.error("Unclassified failure calling host={}", hostId, e);
            throw new HostUnreachableException(hostId, "Unexpected host client failure: " + e.getMessage(), e);
        }
    }
}
