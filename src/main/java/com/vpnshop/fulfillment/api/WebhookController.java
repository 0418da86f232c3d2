package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.IngestResult;
import com.vpnshop.fulfillment.core.WebhookIngressService;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment provider callbacks. The body is taken as the raw string because signatures
 * are computed over the exact bytes the provider sent.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Signed payment notifications from providers")
public class WebhookController {

    private final WebhookIngressService ingressService;

    @PostMapping("/{provider}")
    @Operation(
            summary = "Receive a provider webhook",
            description = "Verifies, parses and applies one provider notification. Providers: yookassa, cryptobot, heleket, tonapi. "
                    + "Duplicates, orphans and payments held for review are acknowledged with 200 so the provider stops retrying.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted, duplicate, ignored, orphaned or held for review. Body: { \"status\": ..., \"orderId\": ... }"),
            @ApiResponse(responseCode = "400", description = "Payload could not be parsed"),
            @ApiResponse(responseCode = "401", description = "Signature or token did not verify"),
            @ApiResponse(responseCode = "404", description = "Unknown provider"),
            @ApiResponse(responseCode = "503", description = "Temporary failure; the provider should redeliver")
    })
    public ResponseEntity<Map<String, Object>> receive(@PathVariable("provider") String provider,
                                                       @RequestBody(required = false) String body,
                                                       @RequestHeader HttpHeaders headers) {
        PaymentProviderType type = PaymentProviderType.fromPathTag(provider)
                .orElseThrow(() -> new UnknownProviderException(provider));
        IngestResult result = ingressService.ingest(type, body == null ? "" : body, headers);
        return respond(result);
    }

    @PostMapping("/events/{eventId}/redrive")
    @Operation(summary = "Re-run a stored payment event", description = "Operator action for an event whose processing failed.")
    public ResponseEntity<Map<String, Object>> redrive(@PathVariable("eventId") String eventId) {
        return respond(ingressService.redrive(eventId));
    }

    private static ResponseEntity<Map<String, Object>> respond(IngestResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.getOutcome().name());
        body.put("orderId", result.getOrderId());
        if (result.getMessage() != null) {
            body.put("message", result.getMessage());
        }
        return ResponseEntity.status(result.getOutcome().getHttpStatus()).body(body);
    }
}
