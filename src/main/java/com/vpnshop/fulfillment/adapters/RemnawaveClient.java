package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vpnshop.fulfillment.compliance.SecretMasker;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.core.HostProvisioningClient;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Remnawave panel. Users are looked up by email (the client reference); an existing
 * user is patched, a missing one is created. The expiry never moves backwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemnawaveClient implements HostProvisioningClient {

    private static final int MAX_USERNAME = 36;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public HostType getHostType() {
        return HostType.REMNAWAVE;
    }

    @Override
    public ProvisioningResult issueCredential(FulfillmentProperties.Host host, ProvisioningRequest request) {
        if (host.getSquadUuid() == null || host.getSquadUuid().isBlank()) {
            throw new HostRejectedException(host.getId(), "No squad configured for Remnawave host " + host.getId());
        }
        Optional<JsonNode> current = findUser(host, request.getClientReference());

        Instant expiresAt = request.getExpiresAt();
        Instant currentExpiry = current.map(u -> parseInstant(u.path("expireAt").asText(null))).orElse(null);
        if (currentExpiry != null && currentExpiry.isAfter(expiresAt)) {
            expiresAt = currentExpiry;
        }

        ObjectNode payload = objectMapper.createObjectNode();
        if (current.isPresent()) {
            payload.put("uuid", current.get().path("uuid").asText());
        } else {
            payload.put("username", username(request.getClientReference()));
        }
        payload.put("status", "ACTIVE");
        payload.put("expireAt", expiresAt.toString());
        payload.put("trafficLimitBytes", request.getTrafficLimitBytes());
        payload.put("trafficLimitStrategy", "NO_RESET");
        payload.putArray("activeInternalSquads").add(host.getSquadUuid());
        payload.put("email", request.getClientReference());

        HttpMethod method = current.isPresent() ? HttpMethod.PATCH : HttpMethod.POST;
        JsonNode user = call(host, method, "/api/users", payload, current.isPresent() ? "update user" : "create user")
                .path("response");
        if (user.isMissingNode() || user.isNull() || !user.hasNonNull("uuid")) {
            throw new HostRejectedException(host.getId(), "Remnawave returned no user");
        }
        log.info("Remnawave user {}: host={}, email={}, expiresAt={}",
                current.isPresent() ? "updated" : "created", host.getId(),
                SecretMasker.maskClientReference(request.getClientReference()), expiresAt);
        return toResult(host, user, request.getClientReference(), expiresAt, current.isPresent());
    }

    @Override
    public Optional<ProvisioningResult> findCredential(FulfillmentProperties.Host host, String clientReference) {
        return findUser(host, clientReference)
                .map(u -> toResult(host, u, clientReference, parseInstant(u.path("expireAt").asText(null)), true));
    }

    @Override
    public void revokeCredential(FulfillmentProperties.Host host, String remoteCredentialId, String clientReference) {
        String uuid = remoteCredentialId;
        if (uuid == null || uuid.isBlank()) {
            Optional<JsonNode> user = findUser(host, clientReference);
            if (user.isEmpty()) {
                log.info("Remnawave user already absent: host={}", host.getId());
                return;
            }
            uuid = user.get().path("uuid").asText();
        }
        try {
            restTemplate.exchange(host.getBaseUrl() + "/api/users/{uuid}", HttpMethod.DELETE,
                    new HttpEntity<>(headers(host)), String.class, uuid);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Remnawave user {} already deleted on host {}", uuid, host.getId());
            return;
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), "delete user", e);
        }
        log.info("Remnawave user deleted: host={}, uuid={}", host.getId(), uuid);
    }

    private Optional<JsonNode> findUser(FulfillmentProperties.Host host, String email) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(host.getBaseUrl() + "/api/users/by-email/{email}",
                    HttpMethod.GET, new HttpEntity<>(headers(host)), String.class, email);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), "find user", e);
        }
        JsonNode user = readBody(host, response.getBody(), "find user").path("response");
        if (user.isArray()) {
            user = user.size() > 0 ? user.get(0) : null;
        }
        if (user == null || user.isMissingNode() || user.isNull() || !user.hasNonNull("uuid")) {
            return Optional.empty();
        }
        return Optional.of(user);
    }

    private JsonNode call(FulfillmentProperties.Host host, HttpMethod method, String path, Object payload, String operation) {
        HttpHeaders headers = headers(host);
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(host.getBaseUrl() + path, method, new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientException e) {
            throw HostCallErrors.classify(host.getId(), operation, e);
        }
        if (response.getStatusCode().value() != HttpStatus.OK.value()
                && response.getStatusCode().value() != HttpStatus.CREATED.value()) {
            throw new HostRejectedException(host.getId(), "Remnawave " + operation + " returned " + response.getStatusCode());
        }
        return readBody(host, response.getBody(), operation);
    }

    private ProvisioningResult toResult(FulfillmentProperties.Host host, JsonNode user, String clientReference,
                                        Instant expiresAt, boolean reused) {
        String link = user.path("subscriptionUrl").asText(null);
        if (link == null && user.hasNonNull("shortUuid")) {
            link = XuiPanelClient.subscriptionLink(host, user.path("shortUuid").asText());
        }
        Instant reported = parseInstant(user.path("expireAt").asText(null));
        return ProvisioningResult.builder()
                .hostId(host.getId())
                .remoteCredentialId(user.path("uuid").asText())
                .clientReference(clientReference)
                .subscriptionLink(link)
                .expiresAt(reported != null ? reported : expiresAt)
                .reusedExisting(reused)
                .build();
    }

    private HttpHeaders headers(FulfillmentProperties.Host host) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(host.getApiToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private JsonNode readBody(FulfillmentProperties.Host host, String body, String operation) {
        if (body == null || body.isBlank()) {
            throw new HostUnreachableException(host.getId(), "Remnawave " + operation + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new HostUnreachableException(host.getId(), "Remnawave " + operation + " returned non-JSON", e);
        }
    }

    static String username(String clientReference) {
        String local = clientReference.split("@", 2)[0].replaceAll("[^A-Za-z0-9_-]", "_");
        return local.length() > MAX_USERNAME ? local.substring(0, MAX_USERNAME) : local;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable Remnawave expireAt '{}'", value);
            return null;
        }
    }
}
