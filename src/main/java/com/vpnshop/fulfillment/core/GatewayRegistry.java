package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One adapter per provider, looked up by the webhook path tag.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayRegistry {

    private final List<PaymentGatewayAdapter> adapters;

    private final Map<PaymentProviderType, PaymentGatewayAdapter> adapterByType = new EnumMap<>(PaymentProviderType.class);

    @PostConstruct
    void init() {
        for (PaymentGatewayAdapter adapter : adapters) {
            PaymentGatewayAdapter previous = adapterByType.putIfAbsent(adapter.getProviderType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two gateway adapters for " + adapter.getProviderType() + ": "
                        + previous.getGatewayName() + ", " + adapter.getGatewayName());
            }
        }
        log.info("Registered gateway adapters: {}", adapterByType.keySet());
        for (PaymentProviderType type : PaymentProviderType.values()) {
            if (!adapterByType.containsKey(type)) {
                log.warn("No gateway adapter for provider={}; its webhooks will be rejected", type);
            }
        }
    }

    public Optional<PaymentGatewayAdapter> find(PaymentProviderType type) {
        return Optional.ofNullable(adapterByType.get(type));
    }
}
