package uk.gegc.antidote.features.dispute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.dispute.api.dto.DisputeDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatusChangeDto;
import uk.gegc.antidote.features.dispute.api.dto.ResolveDisputeRequest;
import uk.gegc.antidote.features.dispute.application.DisputeService;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/billing/disputes")
@RequiredArgsConstructor
@PreAuthorize("hasAuthority('BILLING_ADMIN')")
@Tag(name = "Dispute Administration", description = "Review queue and resolution of lead disputes")
@SecurityRequirement(name = "Basic Authentication")
public class DisputeAdminController {

    private final DisputeService disputeService;

    @Operation(summary = "List disputes", description = "Oldest first, optionally filtered.")
    @ApiResponse(responseCode = "200", description = "Disputes",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = DisputeDto.class))))
    @GetMapping
    public ResponseEntity<List<DisputeDto>> listDisputes(
            @Parameter(description = "Filter by status") @RequestParam(required = false) DisputeStatus status,
            @Parameter(description = "Filter by priority") @RequestParam(required = false) DisputePriority priority
    ) {
        return ResponseEntity.ok(disputeService.listDisputes(status, priority));
    }

    @Operation(
            summary = "Resolve a dispute",
            description = "APPROVED refunds refundAmount credits (default: the full charge); REJECTED has no ledger effect."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dispute resolved",
                    content = @Content(schema = @Schema(implementation = DisputeDto.class))),
            @ApiResponse(responseCode = "400", description = "Refund amount out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Dispute already resolved",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{disputeId}/resolution")
    public ResponseEntity<DisputeDto> resolve(
            @PathVariable UUID disputeId,
            @Valid @RequestBody ResolveDisputeRequest request
    ) {
        return ResponseEntity.ok(disputeService.resolve(disputeId, request.decision(), request.adminNotes(),
                request.refundAmount()));
    }

    @Operation(summary = "Status history of a dispute")
    @ApiResponse(responseCode = "200", description = "Status changes, oldest first",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = DisputeStatusChangeDto.class))))
    @GetMapping("/{disputeId}/history")
    public ResponseEntity<List<DisputeStatusChangeDto>> history(@PathVariable UUID disputeId) {
        return ResponseEntity.ok(disputeService.history(disputeId));
    }
}
