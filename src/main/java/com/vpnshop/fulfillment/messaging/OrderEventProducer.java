package com.vpnshop.fulfillment.messaging;

import com.vpnshop.fulfillment.domain.OrderState;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle events. Inside a transaction the send is deferred until
 * commit so a rolled-back transition is never announced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    private final KafkaTemplate<String, OrderEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${fulfillment.kafka.topic.order-events:order-events}")
    private String topic;

    public void publishTransition(OrderEntity order, OrderState previousState, String detail) {
        OrderEvent event = OrderEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .orderId(order.getOrderId())
                .buyerId(order.getBuyerId())
                .hostId(order.getHostId())
                .planId(order.getPlanId())
                .previousState(previousState)
                .state(order.getState())
                .paymentProvider(order.getPaymentProvider() != null ? order.getPaymentProvider().name() : null)
                .providerTransactionId(order.getProviderTransactionId())
                .amount(order.getPaidAmount() != null ? order.getPaidAmount() : order.getPrice())
                .currencyCode(order.getPaidCurrency() != null ? order.getPaidCurrency() : order.getCurrencyCode())
                .detail(detail)
                .timestamp(clock.instant())
                .build();

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event.getOrderId(), event);
                }
            });
        } else {
            send(event.getOrderId(), event);
        }
    }

    private void send(String key, OrderEvent event) {
        log.debug("Publishing order event: key={}, eventId={}, state={}", key, event.getEventId(), event.getState());
        CompletableFuture<SendResult<String, OrderEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (Exception e) {
            log.error("Failed to hand order event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish order event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published order event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
