package com.vpnshop.fulfillment;

import com.jayway.jsonpath.JsonPath;
import com.vpnshop.fulfillment.adapters.RemnawaveClient;
import com.vpnshop.fulfillment.adapters.XuiPanelClient;
import com.vpnshop.fulfillment.core.NotificationDispatcher;
import com.vpnshop.fulfillment.core.WebhookSignatures;
import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.ProvisioningRequest;
import com.vpnshop.fulfillment.domain.ProvisioningResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration test: order REST API, signed webhook delivery and the Redis dedup marker.
 * Uses Embedded Kafka and Testcontainers Redis. Requires Docker.
 * Excluded from the default build; run with {@code mvn test -Pintegration} where Docker is available.
 */
@Tag("integration")
@SpringBootTest(classes = FulfillmentApplication.class)
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "order-events" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class FulfillmentPipelineIntegrationTest {

    private static final String YOOKASSA_SECRET = "yk-test-secret";

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private XuiPanelClient xuiClient;
    @MockitoBean
    private RemnawaveClient remnawaveClient;
    @MockitoBean
    private NotificationDispatcher notificationDispatcher;

    @BeforeEach
    void setUp() {
        when(xuiClient.getHostType()).thenReturn(HostType.XUI);
        when(remnawaveClient.getHostType()).thenReturn(HostType.REMNAWAVE);
        when(xuiClient.issueCredential(any(), any())).thenAnswer(inv -> {
            ProvisioningRequest request = inv.getArgument(1);
            return ProvisioningResult.builder()
                    .hostId(request.getHostId())
                    .remoteCredentialId(request.getClientUuid())
                    .clientReference(request.getClientReference())
                    .subscriptionLink("http://xui.test/sub/" + request.getClientUuid())
                    .expiresAt(request.getExpiresAt())
                    .build();
        });
    }

    @Test
    @DisplayName("Paid order is fulfilled and a redelivered webhook is answered as a duplicate")
    void webhookFulfillsOrderOnce() throws Exception {
        String created = mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "buyerId": "700100",
                                  "planId": "month-1",
                                  "hostId": "nl-1",
                                  "nonce": "int-nonce-1"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CREATED"))
                .andReturn().getResponse().getContentAsString();
        String orderId = JsonPath.read(created, "$.orderId");

        String checkout = mockMvc.perform(post("/api/v1/orders/{orderId}/checkout", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"providerType\": \"YOOKASSA\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AWAITING_PAYMENT"))
                .andReturn().getResponse().getContentAsString();
        String reference = JsonPath.read(checkout, "$.paymentReference");

        String txId = UUID.randomUUID().toString();
        String body = "{\"type\":\"notification\",\"event\":\"payment.succeeded\",\"object\":{"
                + "\"id\":\"" + txId + "\",\"status\":\"succeeded\","
                + "\"amount\":{\"value\":\"199.00\",\"currency\":\"RUB\"},"
                + "\"metadata\":{\"payment_reference\":\"" + reference + "\"}}}";
        String signature = WebhookSignatures.hmacSha256Hex(YOOKASSA_SECRET.getBytes(StandardCharsets.UTF_8), body);

        mockMvc.perform(post("/api/v1/webhooks/yookassa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", signature)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.orderId").value(orderId));

        mockMvc.perform(post("/api/v1/webhooks/yookassa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", signature)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DUPLICATE"));

        mockMvc.perform(get("/api/v1/orders/{orderId}", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state", is("FULFILLED")))
                .andExpect(jsonPath("$.providerTransactionId", is(txId)));
        verify(xuiClient, times(1)).issueCredential(any(), any());
    }

    @Test
    @DisplayName("Webhook with a forged signature is rejected with 401")
    void forgedSignatureIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/webhooks/yookassa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", "00ff")
                        .content("{\"event\":\"payment.succeeded\",\"object\":{\"id\":\"forged\"}}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }
}
