package uk.gegc.antidote.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.billing.api.dto.BalanceDto;
import uk.gegc.antidote.features.billing.api.dto.TopUpOrderDto;
import uk.gegc.antidote.features.billing.api.dto.TopUpRequest;
import uk.gegc.antidote.features.billing.api.dto.TransactionPageDto;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing/clinics/{clinicId}")
@RequiredArgsConstructor
@Validated
@Tag(name = "Clinic Billing", description = "Credit balance, ledger history and top-ups of a clinic")
@SecurityRequirement(name = "Basic Authentication")
public class ClinicBillingController {

    private final BillingService billingService;

    @Operation(summary = "Get credit balance", description = "Returns the cached balance and the low-balance flag.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance retrieved",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(@PathVariable Long clinicId) {
        return ResponseEntity.ok(billingService.getBalance(clinicId));
    }

    @Operation(
            summary = "List ledger entries",
            description = "Most recent first. Pass nextPageToken from the previous page to continue."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of ledger entries",
                    content = @Content(schema = @Schema(implementation = TransactionPageDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid page size or page token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/transactions")
    public ResponseEntity<TransactionPageDto> listTransactions(
            @PathVariable Long clinicId,
            @Parameter(description = "Opaque cursor from the previous page") @RequestParam(required = false) String pageToken,
            @Parameter(description = "Page size, 1 to 100") @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "Filter by entry kind") @RequestParam(required = false) CreditTransactionKind kind
    ) {
        return ResponseEntity.ok(billingService.listTransactions(clinicId, pageToken, size, kind));
    }

    @Operation(
            summary = "Start a credit top-up",
            description = "Creates a payment processor order and a pending purchase. The returned checkout "
                    + "parameters are handed to the processor's checkout widget."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order created",
                    content = @Content(schema = @Schema(implementation = TopUpOrderDto.class))),
            @ApiResponse(responseCode = "400", description = "Amount outside the allowed range or account inactive",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Promo code rejected",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment processor unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/top-ups")
    public ResponseEntity<TopUpOrderDto> initiateTopUp(
            @PathVariable Long clinicId,
            @Valid @RequestBody TopUpRequest request
    ) {
        TopUpOrderDto order = billingService.initiateTopUp(clinicId, request.amount(), request.promoCode());
        log.info("Top-up order {} created for clinic {}", order.orderId(), clinicId);
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }
}
