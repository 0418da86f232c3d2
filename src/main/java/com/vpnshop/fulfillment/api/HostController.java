package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.HostRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/hosts")
@RequiredArgsConstructor
@Tag(name = "Hosts", description = "Configured VPN hosts and their health")
public class HostController {

    private final HostRegistry hostRegistry;

    @GetMapping
    @Operation(summary = "List hosts", description = "A host is marked unhealthy after its panel refuses our credentials.")
    public ResponseEntity<List<HostRegistry.HostStatus>> list() {
        return ResponseEntity.ok(hostRegistry.listHosts());
    }

    @PostMapping("/{hostId}/healthy")
    @Operation(summary = "Mark host healthy", description = "Operator action after fixing the panel credentials.")
    public ResponseEntity<HostRegistry.HostStatus> markHealthy(@PathVariable("hostId") String hostId) {
        hostRegistry.markHealthy(hostId);
        log.info("Host {} marked healthy by operator", hostId);
        return ResponseEntity.ok(hostRegistry.listHosts().stream()
                .filter(h -> h.getHostId().equals(hostId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown host: " + hostId)));
    }
}
