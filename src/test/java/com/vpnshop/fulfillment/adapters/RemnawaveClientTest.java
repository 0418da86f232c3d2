package com.vpnshop.fulfillment.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnshop.fulfillment.config.FulfillmentProperties;
import com.vpnshop.fulfillment.domain.HostAuthFailedException;
import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemnawaveClientTest {

    private static final String BASE = "http://remnawave.test";
    private static final String EMAIL = "o-0123456789abcdef0123@de-1";
    private static final Instant EXPIRES = Instant.parse("2026-04-01T00:00:00Z");
    private static final String USER = "{\"response\":{\"uuid\":\"u-1\",\"shortUuid\":\"short1\","
            + "\"subscriptionUrl\":\"https://sub.example.net/short1\",\"expireAt\":\"%s\"}}";

    private MockRestServiceServer server;
    private RemnawaveClient client;
    private FulfillmentProperties.Host host;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RemnawaveClient(restTemplate, new ObjectMapper());
        host = new FulfillmentProperties.Host();
        host.setId("de-1");
        host.setType(HostType.REMNAWAVE);
        host.setBaseUrl(BASE);
        host.setApiToken("rw-test-token");
        host.setSquadUuid("squad-1");
    }

    @Test
    void issueCreatesUserWhenEmailUnknown() {
        server.expect(requestTo(BASE + "/api/users/by-email/" + EMAIL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer rw-test-token"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/api/users"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.username").value("o-0123456789abcdef0123"))
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.expireAt").value(EXPIRES.toString()))
                .andExpect(jsonPath("$.activeInternalSquads[0]").value("squad-1"))
                .andRespond(withStatus(HttpStatus.CREATED).contentType(MediaType.APPLICATION_JSON)
                        .body(String.format(USER, "2026-04-01T00:00:00.000Z")));

        ProvisioningResult result = client.issueCredential(host, request());

        server.verify();
        assertThat(result.getRemoteCredentialId()).isEqualTo("u-1");
        assertThat(result.getSubscriptionLink()).isEqualTo("https://sub.example.net/short1");
        assertThat(result.getExpiresAt()).isEqualTo(EXPIRES);
        assertThat(result.isReusedExisting()).isFalse();
    }

    @Test
    void issuePatchesExistingUserAndNeverShortensExpiry() {
        String later = "2026-06-01T00:00:00Z";
        server.expect(requestTo(BASE + "/api/users/by-email/" + EMAIL))
                .andRespond(withSuccess("{\"response\":[{\"uuid\":\"u-1\",\"expireAt\":\"" + later + "\"}]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/users"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(jsonPath("$.uuid").value("u-1"))
                .andExpect(jsonPath("$.expireAt").value(later))
                .andRespond(withSuccess(String.format(USER, later), MediaType.APPLICATION_JSON));

        ProvisioningResult result = client.issueCredential(host, request());

        server.verify();
        assertThat(result.isReusedExisting()).isTrue();
        assertThat(result.getExpiresAt()).isEqualTo(Instant.parse(later));
    }

    @Test
    void unauthorizedIsAuthFailure() {
        server.expect(requestTo(BASE + "/api/users/by-email/" + EMAIL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.issueCredential(host, request())).isInstanceOf(HostAuthFailedException.class);
    }

    @Test
    void tooManyRequestsIsUnreachable() {
        server.expect(requestTo(BASE + "/api/users/by-email/" + EMAIL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.issueCredential(host, request())).isInstanceOf(HostUnreachableException.class);
    }

    @Test
    void revokeTreatsMissingUserAsDone() {
        server.expect(requestTo(BASE + "/api/users/u-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        client.revokeCredential(host, "u-1", EMAIL);

        server.verify();
    }

    @Test
    void usernameIsSanitizedLocalPart() {
        assertThat(RemnawaveClient.username("o-abc.def@host")).isEqualTo("o-abc_def");
    }

    private static ProvisioningRequest request() {
        return ProvisioningRequest.builder()
                .orderId("order-1")
                .hostId("de-1")
                .buyerId("42")
                .clientReference(EMAIL)
                .clientUuid("5b0d3c0e-7d1a-3f3e-9a43-1c2b3d4e5f60")
                .expiresAt(EXPIRES)
                .trafficLimitBytes(0)
                .build();
    }
}
