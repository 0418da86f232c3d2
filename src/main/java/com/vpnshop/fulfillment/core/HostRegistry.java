package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostUnavailableException;
import com.vpnshop.fulfillment.persistence.entity.HostHealthEntity;
import com.vpnshop.fulfillment.persistence.repository.HostHealthRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configured hosts, the client that speaks to each, and their persisted health flag.
 * Unhealthy hosts take no new orders and receive no provisioning calls until an
 * operator marks them healthy again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HostRegistry {

    private final FulfillmentProperties properties;
    private final List<HostProvisioningClient> clients;
    private final HostHealthRepository healthRepository;
    private final Clock clock;

    @PostConstruct
    void init() {
        log.info("Configured hosts: {}", properties.getHosts().stream()
                .map(h -> h.getId() + "(" + h.getType() + ")").collect(Collectors.toList()));
        if (properties.getHosts().isEmpty()) {
            log.warn("No hosts configured; every order will be refused");
        }
    }

    public FulfillmentProperties.Host getHost(String hostId) {
        return properties.findHost(hostId)
                .orElseThrow(() -> new HostUnavailableException("Unknown host: " + hostId));
    }

    public HostProvisioningClient clientFor(FulfillmentProperties.Host host) {
        return clients.stream()
                .filter(c -> c.getHostType() == host.getType())
                .findFirst()
                .orElseThrow(() -> new HostUnavailableException("No client for host type " + host.getType()));
    }

    @Transactional(readOnly = true)
    public boolean isHealthy(String hostId) {
        return healthRepository.findById(hostId).map(HostHealthEntity::isHealthy).orElse(true);
    }

    @Transactional
    public void markUnhealthy(String hostId, String reason) {
        save(hostId, false, reason);
        log.error("Host {} marked unhealthy: {}", hostId, reason);
    }

    @Transactional
    public void markHealthy(String hostId) {
        getHost(hostId);
        save(hostId, true, null);
        log.info("Host {} marked healthy", hostId);
    }

    @Transactional(readOnly = true)
    public List<HostStatus> listHosts() {
        return properties.getHosts().stream()
                .map(h -> {
                    HostHealthEntity health = healthRepository.findById(h.getId()).orElse(null);
                    return new HostStatus(h.getId(), h.getType().name(),
                            health == null || health.isHealthy(),
                            health != null ? health.getReason() : null);
                })
                .collect(Collectors.toList());
    }

    private void save(String hostId, boolean healthy, String reason) {
        HostHealthEntity entity = healthRepository.findById(hostId)
                .orElseGet(() -> HostHealthEntity.builder().hostId(hostId).build());
        entity.setHealthy(healthy);
        entity.setReason(reason);
        entity.setChangedAt(clock.instant());
        healthRepository.save(entity);
    }

    @Value
    public static class HostStatus {
        String hostId;
        String type;
        boolean healthy;
        String reason;
    }
}
