package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vpnshop.fulfillment.compliance.SecretMasker;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.HostProvisioningClient;
import com.vpnshop.fulfillment.domain.HostAuthFailedException;
import com.vpnshop.fulfillment.domain.HostRejectedException;
import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 3x-ui panel. Clients live inside one inbound and are keyed by email, which is the
 * order's client reference, so issuing twice finds and updates the first client.
 * Every operation logs in afresh with the panel's form login and session cookie.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XuiPanelClient implements HostProvisioningClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public HostType getHostType() {
        return HostType.XUI;
    }

    @Override
    public ProvisioningResult issueCredential(FulfillmentProperties.Host host, ProvisioningRequest request) {
        String cookie = login(host);
        Optional<JsonNode> existing = findClient(host, cookie, request.getClientReference());

        ObjectNode client = objectMapper.createObjectNode();
        String clientId = existing.map(c -> c.path("id").asText(null)).orElse(request.getClientUuid());
        String subId = existing.map(c -> c.path("subId").asText(null))
                .filter(s -> !s.isBlank())
                .orElse(request.getClientUuid().replace("-", "").substring(0, 16));
        client.put("id", clientId);
        client.put("email", request.getClientReference());
        client.put("enable", true);
        client.put("flow", host.getFlow());
        client.put("limitIp", 0);
        client.put("totalGB", request.getTrafficLimitBytes());
        client.put("expiryTime", request.getExpiresAt().toEpochMilli());
        client.put("tgId", request.getBuyerId());
        client.put("subId", subId);
        client.put("reset", 0);

        String path = existing.isPresent()
                ? "/panel/api/inbounds/updateClient/" + clientId
                : "/panel/api/inbounds/addClient";
        post(host, cookie, path, clientPayload(host, client), existing.isPresent() ? "updateClient" : "addClient");
        log.info("3x-ui client {}: host={}, inbound={}, email={}, expiresAt={}",
                existing.isPresent() ? "updated" : "created", host.getId(), host.getInboundId(),
                SecretMasker.maskClientReference(request.getClientReference()), request.getExpiresAt());

        return ProvisioningResult.builder()
                .hostId(host.getId())
                .remoteCredentialId(clientId)
                .clientReference(request.getClientReference())
                .subscriptionLink(subscriptionLink(host, subId))
                .expiresAt(request.getExpiresAt())
                .reusedExisting(existing.isPresent())
                .build();
    }

    @Override
    public Optional<ProvisioningResult> findCredential(FulfillmentProperties.Host host, String clientReference) {
        String cookie = login(host);
        return findClient(host, cookie, clientReference).map(c -> ProvisioningResult.builder()
                .hostId(host.getId())
                .remoteCredentialId(c.path("id").asText())
                .clientReference(clientReference)
                .subscriptionLink(subscriptionLink(host, c.path("subId").asText()))
                .expiresAt(c.path("expiryTime").asLong() > 0 ? Instant.ofEpochMilli(c.path("expiryTime").asLong()) : null)
                .reusedExisting(true)
                .build());
    }

    @Override
    public void revokeCredential(FulfillmentProperties.Host host, String remoteCredentialId, String clientReference) {
        String cookie = login(host);
        Optional<JsonNode> existing = findClient(host, cookie, clientReference);
        if (existing.isEmpty()) {
            log.info("3x-ui client already absent: host={}, email={}", host.getId(), SecretMasker.maskClientReference(clientReference));
            return;
        }
        String clientId = existing.get().path("id").asText(remoteCredentialId);
        post(host, cookie, "/panel/api/inbounds/" + inboundId(host) + "/delClient/" + clientId, null, "delClient");
        log.info("3x-ui client removed: host={}, clientId={}", host.getId(), clientId);
    }

    private String login(FulfillmentProperties.Host host) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", host.getUsername());
        form.add("password", host.getPassword());

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(host.getBaseUrl() + "/login", new HttpEntity<>(form, headers), String.class);
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), "login", e);
        }
        JsonNode body = readBody(host, response.getBody(), "login");
        List<String> cookies = response.getHeaders().getOrEmpty(HttpHeaders.SET_COOKIE);
        if (!body.path("success").asBoolean(false) || cookies.isEmpty()) {
            throw new HostAuthFailedException(host.getId(), "3x-ui login refused: " + body.path("msg").asText(""));
        }
        return cookies.stream().map(c -> c.split(";", 2)[0]).collect(Collectors.joining("; "));
    }

    private Optional<JsonNode> findClient(FulfillmentProperties.Host host, String cookie, String email) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.COOKIE, cookie);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(host.getBaseUrl() + "/panel/api/inbounds/get/" + inboundId(host),
                    HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), "get inbound", e);
        }
        JsonNode body = readBody(host, response.getBody(), "get inbound");
        if (!body.path("success").asBoolean(false)) {
            throw new HostRejectedException(host.getId(), "Inbound " + host.getInboundId() + " not available: "
                    + body.path("msg").asText(""));
        }
        JsonNode settings = readBody(host, body.path("obj").path("settings").asText("{}"), "inbound settings");
        for (JsonNode client : settings.path("clients")) {
            if (email.equalsIgnoreCase(client.path("email").asText())) {
                return Optional.of(client);
            }
        }
        return Optional.empty();
    }

    private void post(FulfillmentProperties.Host host, String cookie, String path, Object payload, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.COOKIE, cookie);
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(host.getBaseUrl() + path, new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), operation, e);
        }
        JsonNode body = readBody(host, response.getBody(), operation);
        if (!body.path("success").asBoolean(false)) {
            throw new HostRejectedException(host.getId(), "3x-ui " + operation + " failed: " + body.path("msg").asText(""));
        }
    }

    private ObjectNode clientPayload(FulfillmentProperties.Host host, ObjectNode client) {
        ObjectNode settings = objectMapper.createObjectNode();
        ArrayNode clients = settings.putArray("clients");
        clients.add(client);
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", inboundId(host));
        try {
            payload.put("settings", objectMapper.writeValueAsString(settings));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize 3x-ui client settings", e);
        }
        return payload;
    }

    private JsonNode readBody(FulfillmentProperties.Host host, String body, String operation) {
        if (body == null || body.isBlank()) {
            throw new HostUnreachableException(host.getId(), "3x-ui " + operation + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new HostUnreachableException(host.getId(), "3x-ui " + operation + " returned non-JSON", e);
        }
    }

    private static int inboundId(FulfillmentProperties.Host host) {
        if (host.getInboundId() == null) {
            throw new HostRejectedException(host.getId(), "No inbound configured for 3x-ui host " + host.getId());
        }
        return host.getInboundId();
    }

    static String subscriptionLink(FulfillmentProperties.Host host, String token) {
        String template = host.getSubscriptionTemplate();
        if (template == null || template.isBlank()) {
            return host.getBaseUrl() + "/sub/" + token;
        }
        return template.contains("{token}") ? template.replace("{token}", token) : template + token;
    }
}
