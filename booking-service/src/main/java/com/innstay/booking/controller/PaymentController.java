package com.innstay.booking.controller;

import com.innstay.booking.dto.request.CheckoutRequest;
import com.innstay.booking.dto.response.CheckoutResponse;
import com.innstay.booking.payment.CheckoutService;
import com.innstay.booking.payment.PaymentWebhookService;
import com.innstay.booking.payment.SettlementOutcome;
import com.innstay.booking.payment.WebhookSignatureVerifier;
import com.innstay.booking.security.ActorContext;
import com.innstay.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Payment", description = "Checkout sessions and provider callbacks")
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final CheckoutService checkoutService;
    private final PaymentWebhookService paymentWebhookService;

    @Operation(summary = "Create checkout session",
            description = "Re-verifies the booking total against current rates before contacting the provider")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Checkout session ready"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Booking is already paid"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Access denied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Price has changed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many attempts"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Payment provider unavailable")
    })
    @PostMapping("/checkout")
    public ResponseEntity<ApiResponse<CheckoutResponse>> createCheckout(
            @Valid @RequestBody CheckoutRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        CheckoutResponse response = checkoutService.createCheckout(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @Operation(summary = "Payment provider webhook", description = "Signed provider callback")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Event accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Invalid signature")
    })
    @PostMapping("/webhook")
    public ResponseEntity<ApiResponse<SettlementOutcome>> handleWebhook(
            @RequestHeader(value = WebhookSignatureVerifier.HEADER, required = false) String signature,
            @RequestBody String rawBody) {
        return ResponseEntity.ok(ApiResponse.ok(paymentWebhookService.handle(rawBody, signature).orElse(null)));
    }
}
