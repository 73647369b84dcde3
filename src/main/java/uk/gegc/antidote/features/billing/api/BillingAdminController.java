package uk.gegc.antidote.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.billing.api.dto.AdjustmentRequest;
import uk.gegc.antidote.features.billing.api.dto.BalanceDto;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentRequest;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentResult;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.api.dto.TransferRequest;
import uk.gegc.antidote.features.billing.api.dto.TransferResult;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.billing.application.BulkAdjustmentService;
import uk.gegc.antidote.features.ledger.application.ReconciliationService;
import uk.gegc.antidote.features.ledger.application.ReconciliationService.ReconciliationResult;
import uk.gegc.antidote.features.ledger.application.ReconciliationService.ReconciliationSummary;

@RestController
@RequestMapping("/api/v1/admin/billing")
@RequiredArgsConstructor
@PreAuthorize("hasAuthority('BILLING_ADMIN')")
@Tag(name = "Billing Administration", description = "Accounts, manual adjustments, transfers and ledger reconciliation")
@SecurityRequirement(name = "Basic Authentication")
public class BillingAdminController {

    private final BillingService billingService;
    private final BulkAdjustmentService bulkAdjustmentService;
    private final ReconciliationService reconciliationService;

    @Operation(summary = "Open or reactivate a clinic account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account open",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "403", description = "Administrator privilege required",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/clinics/{clinicId}/account")
    public ResponseEntity<BalanceDto> openAccount(@PathVariable Long clinicId) {
        return ResponseEntity.ok(billingService.openAccount(clinicId));
    }

    @Operation(summary = "Deactivate a clinic account", description = "Blocks new top-ups; in-flight entries still settle.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Account deactivated"),
            @ApiResponse(responseCode = "404", description = "Account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/clinics/{clinicId}/account")
    public ResponseEntity<Void> deactivateAccount(@PathVariable Long clinicId) {
        billingService.deactivateAccount(clinicId);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Adjust a clinic balance",
            description = "Writes a completed ADMIN_ADJUSTMENT entry. Requests repeating an idempotency key are applied once."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Adjustment recorded",
                    content = @Content(schema = @Schema(implementation = TransactionDto.class))),
            @ApiResponse(responseCode = "400", description = "Zero amount or missing reason",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/clinics/{clinicId}/adjustments")
    public ResponseEntity<TransactionDto> adjustBalance(
            @PathVariable Long clinicId,
            @Valid @RequestBody AdjustmentRequest request
    ) {
        TransactionDto tx = billingService.adjustBalance(clinicId, request.amount(), request.reason(), request.idempotencyKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }

    @Operation(
            summary = "Apply many adjustments",
            description = "Each adjustment runs in its own transaction; the response reports every item's outcome."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Per-item results",
                    content = @Content(schema = @Schema(implementation = BulkAdjustmentResult.class))),
            @ApiResponse(responseCode = "400", description = "Empty or malformed batch",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/adjustments/bulk")
    public ResponseEntity<BulkAdjustmentResult> bulkAdjust(@Valid @RequestBody BulkAdjustmentRequest request) {
        return ResponseEntity.ok(bulkAdjustmentService.applyAll(request));
    }

    @Operation(
            summary = "Transfer credits between clinics",
            description = "Debits the source and credits the destination in one transaction. The source balance must cover the amount."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Transfer recorded",
                    content = @Content(schema = @Schema(implementation = TransferResult.class))),
            @ApiResponse(responseCode = "400", description = "Same clinic, non-positive amount or insufficient credits",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Source account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/transfers")
    public ResponseEntity<TransferResult> transfer(@Valid @RequestBody TransferRequest request) {
        TransferResult result = billingService.transferCredits(request.fromClinicId(), request.toClinicId(),
                request.amount(), request.reason(), request.idempotencyKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @Operation(summary = "Reconcile all accounts", description = "Recomputes every cached balance from the ledger and repairs drift.")
    @ApiResponse(responseCode = "200", description = "Reconciliation summary",
            content = @Content(schema = @Schema(implementation = ReconciliationSummary.class)))
    @PostMapping("/reconciliation")
    public ResponseEntity<ReconciliationSummary> reconcileAll() {
        return ResponseEntity.ok(reconciliationService.reconcileAll());
    }

    @Operation(summary = "Reconcile one account")
    @ApiResponse(responseCode = "200", description = "Reconciliation result",
            content = @Content(schema = @Schema(implementation = ReconciliationResult.class)))
    @PostMapping("/reconciliation/{clinicId}")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable Long clinicId) {
        return ResponseEntity.ok(reconciliationService.reconcile(clinicId));
    }
}
