package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostRejectedException;
import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProvisioningDispatcherTest {

    @Mock
    private OrderStateMachine stateMachine;
    @Mock
    private HostRegistry hostRegistry;
    @Mock
    private HostProvisioningClient client;

    private CircuitBreakerRegistry circuitBreakerRegistry;
    private FulfillmentProperties.Host host;
    private ProvisioningDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        FulfillmentProperties properties = new FulfillmentProperties();
        properties.getProvisioning().setQueueWait(Duration.ofMillis(50));
        host = new FulfillmentProperties.Host();
        host.setId("nl-1");
        host.setType(HostType.XUI);
        host.setBaseUrl("http://xui.test");
        host.setMaxConcurrentCalls(1);
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        dispatcher = new ProvisioningDispatcher(stateMachine, hostRegistry, circuitBreakerRegistry,
                BulkheadRegistry.ofDefaults(), properties);
        lenient().when(hostRegistry.getHost("nl-1")).thenReturn(host);
        lenient().when(hostRegistry.isHealthy("nl-1")).thenReturn(true);
        lenient().when(hostRegistry.clientFor(host)).thenReturn(client);
    }

    @Test
    void nothingDueMeansNoHostCall() {
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.empty());

        assertThat(dispatcher.attempt("order-1")).isEqualTo(ProvisioningDispatcher.AttemptOutcome.NOT_DUE);
        verify(hostRegistry, never()).clientFor(any());
    }

    @Test
    void successfulCallCompletesOrder() {
        ProvisioningRequest request = request();
        ProvisioningResult result = ProvisioningResult.builder().hostId("nl-1").remoteCredentialId("r-1")
                .clientReference(request.getClientReference()).expiresAt(request.getExpiresAt()).build();
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.of(request));
        when(client.issueCredential(host, request)).thenReturn(result);
        when(stateMachine.completeProvisioning("order-1", result)).thenReturn(true);

        assertThat(dispatcher.attempt("order-1")).isEqualTo(ProvisioningDispatcher.AttemptOutcome.FULFILLED);
    }

    @Test
    void classifiedFailureIsHandedToStateMachine() {
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.of(request()));
        HostUnreachableException timeout = new HostUnreachableException("nl-1", "timeout");
        when(client.issueCredential(eq(host), any())).thenThrow(timeout);
        when(stateMachine.failProvisioningAttempt("order-1", timeout)).thenReturn(OrderStateMachine.FailureOutcome.RETRY_SCHEDULED);

        assertThat(dispatcher.attempt("order-1")).isEqualTo(ProvisioningDispatcher.AttemptOutcome.RETRY_SCHEDULED);
    }

    @Test
    void unexpectedClientErrorCountsAsUnreachable() {
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.of(request()));
        when(client.issueCredential(eq(host), any())).thenThrow(new NullPointerException("bug"));
        when(stateMachine.failProvisioningAttempt(eq("order-1"), any())).thenReturn(OrderStateMachine.FailureOutcome.RETRY_SCHEDULED);

        dispatcher.attempt("order-1");

        ArgumentCaptor<ProvisioningException> error = ArgumentCaptor.forClass(ProvisioningException.class);
        verify(stateMachine).failProvisioningAttempt(eq("order-1"), error.capture());
        assertThat(error.getValue()).isInstanceOf(HostUnreachableException.class);
    }

    @Test
    void openCircuitSkipsHostAndIsRetryable() {
        circuitBreakerRegistry.circuitBreaker("host-nl-1").transitionToOpenState();
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.of(request()));
        when(stateMachine.failProvisioningAttempt(eq("order-1"), any(HostUnreachableException.class)))
                .thenReturn(OrderStateMachine.FailureOutcome.RETRY_SCHEDULED);

        assertThat(dispatcher.attempt("order-1")).isEqualTo(ProvisioningDispatcher.AttemptOutcome.RETRY_SCHEDULED);
        verify(client, never()).issueCredential(any(), any());
        assertThat(circuitBreakerRegistry.circuitBreaker("host-nl-1").getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    void unhealthyHostIsNotCalled() {
        when(hostRegistry.isHealthy("nl-1")).thenReturn(false);
        when(stateMachine.beginProvisioningAttempt("order-1")).thenReturn(Optional.of(request()));
        when(stateMachine.failProvisioningAttempt(eq("order-1"), any(HostUnreachableException.class)))
                .thenReturn(OrderStateMachine.FailureOutcome.RETRY_SCHEDULED);

        dispatcher.attempt("order-1");

        verify(client, never()).issueCredential(any(), any());
    }

    @Test
    void revokePropagatesHostRejection() {
        doThrow(new HostRejectedException("nl-1", "bad request"))
                .when(client).revokeCredential(host, "r-1", "o-x@nl-1");

        assertThatThrownBy(() -> dispatcher.revoke("nl-1", "r-1", "o-x@nl-1"))
                .isInstanceOf(HostRejectedException.class);
    }

    private static ProvisioningRequest request() {
        return ProvisioningRequest.builder()
                .orderId("order-1")
                .hostId("nl-1")
                .buyerId("42")
                .clientReference("o-x@nl-1")
                .clientUuid("5b0d3c0e-7d1a-3f3e-9a43-1c2b3d4e5f60")
                .expiresAt(Instant.parse("2026-04-01T00:00:00Z"))
                .build();
    }
}
