package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.CreateOrderCommand;
import com.vpnshop.fulfillment.core.FulfillmentCoordinator;
import com.vpnshop.fulfillment.core.OrderStateMachine;
import com.vpnshop.fulfillment.persistence.entity.OrderEntity;
import com.vpnshop.fulfillment.persistence.service.OrderLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order creation and checkout as called by the bot, plus the operator refund.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Tag(name = "Orders", description = "Create, check out, query and refund orders")
public class OrderController {

    private final FulfillmentCoordinator coordinator;
    private final OrderStateMachine stateMachine;
    private final OrderLedger ledger;

    @PostMapping
    @Operation(
            summary = "Create order",
            description = "Creates a purchase or, with renewalOfOrderId, a renewal of an existing credential. "
                    + "Repeating the call with the same buyerId, planId and nonce returns the same order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order created or returned",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = OrderResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed, unknown plan, or nothing to renew"),
            @ApiResponse(responseCode = "409", description = "Host not accepting orders")
    })
    public ResponseEntity<OrderResponseDto> create(@Valid @RequestBody CreateOrderRequestDto dto) {
        CreateOrderCommand command = CreateOrderCommand.builder()
                .buyerId(dto.getBuyerId())
                .planId(dto.getPlanId())
                .hostId(dto.getHostId())
                .nonce(dto.getNonce())
                .renewalOfOrderId(dto.getRenewalOfOrderId())
                .build();
        OrderEntity order = coordinator.createOrder(command);
        return ResponseEntity.ok(OrderResponseDto.from(order));
    }

    @PostMapping("/{orderId}/checkout")
    @Operation(
            summary = "Start checkout",
            description = "Moves the order to AWAITING_PAYMENT and returns the paymentReference the provider invoice must carry.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checkout started or repeated"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order is past checkout")
    })
    public ResponseEntity<OrderResponseDto> checkout(@PathVariable("orderId") String orderId,
                                                     @Valid @RequestBody CheckoutRequestDto dto) {
        OrderEntity order = stateMachine.awaitPayment(orderId, dto.getProviderType(), dto.getQuotedAmount(), dto.getQuotedCurrency());
        return ResponseEntity.ok(OrderResponseDto.from(order));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get order")
    public ResponseEntity<OrderResponseDto> get(@PathVariable("orderId") String orderId) {
        return ResponseEntity.ok(OrderResponseDto.from(ledger.getOrder(orderId)));
    }

    @PostMapping("/{orderId}/refund")
    @Operation(
            summary = "Refund order",
            description = "Operator action after the money was returned out of band. Revokes the credential where one exists.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order refunded"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order was never paid or is already closed")
    })
    public ResponseEntity<OrderResponseDto> refund(@PathVariable("orderId") String orderId,
                                                   @RequestBody(required = false) RefundRequestDto dto) {
        String note = dto != null ? dto.getNote() : null;
        log.info("Refund requested: orderId={}", orderId);
        return ResponseEntity.ok(OrderResponseDto.from(coordinator.refund(orderId, note)));
    }
}
