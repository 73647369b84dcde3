package uk.gegc.antidote.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmRequest;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.billing.application.PaymentWebhookService;

/**
 * Unauthenticated processor-facing endpoints. Both are trusted only through their HMAC signatures.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/billing/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Payment processor callbacks")
public class PaymentController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private final BillingService billingService;
    private final PaymentWebhookService webhookService;

    @Operation(
            summary = "Confirm a top-up",
            description = "Checkout callback carrying the processor order id, payment id and signature. "
                    + "Repeating a confirmed callback returns the original result with duplicate=true."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Purchase credited, or already credited",
                    content = @Content(schema = @Schema(implementation = TopUpConfirmation.class))),
            @ApiResponse(responseCode = "400", description = "Signature mismatch",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown order",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/confirm")
    public ResponseEntity<TopUpConfirmation> confirm(@Valid @RequestBody TopUpConfirmRequest request) {
        return ResponseEntity.ok(billingService.confirmTopUp(request.orderId(), request.paymentId(), request.signature()));
    }

    @Operation(
            summary = "Handle processor webhook",
            description = "Signed event notifications. payment.captured credits the purchase, payment.failed fails it."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Webhook accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/webhook")
    public ResponseEntity<String> handleWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Processor signature header") @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature
    ) {
        var result = webhookService.process(payload, signature);
        log.debug("Payment webhook handled: {}", result);
        return ResponseEntity.ok("");
    }
}
