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
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.dispute.api.dto.DisputeDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatsDto;
import uk.gegc.antidote.features.dispute.api.dto.FileDisputeRequest;
import uk.gegc.antidote.features.dispute.application.DisputeService;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;

import java.util.List;

@RestController
@RequestMapping("/api/v1/billing/clinics/{clinicId}/disputes")
@RequiredArgsConstructor
@Tag(name = "Lead Disputes", description = "Disputes a clinic files against lead charges")
@SecurityRequirement(name = "Basic Authentication")
public class ClinicDisputeController {

    private final DisputeService disputeService;

    @Operation(summary = "Dispute a lead charge", description = "A charge can be disputed once.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Dispute filed",
                    content = @Content(schema = @Schema(implementation = DisputeDto.class))),
            @ApiResponse(responseCode = "404", description = "The clinic was never charged for the lead",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "A dispute for the charge already exists",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<DisputeDto> fileDispute(
            @PathVariable Long clinicId,
            @Valid @RequestBody FileDisputeRequest request
    ) {
        DisputeDto dispute = disputeService.fileDispute(request.leadId(), clinicId, request.reason(),
                request.description(), request.priority());
        return ResponseEntity.status(HttpStatus.CREATED).body(dispute);
    }

    @Operation(summary = "List the clinic's disputes", description = "Newest first.")
    @ApiResponse(responseCode = "200", description = "Disputes",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = DisputeDto.class))))
    @GetMapping
    public ResponseEntity<List<DisputeDto>> listDisputes(
            @PathVariable Long clinicId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) DisputeStatus status
    ) {
        return ResponseEntity.ok(disputeService.listClinicDisputes(clinicId, status));
    }

    @Operation(summary = "Dispute counts per status")
    @ApiResponse(responseCode = "200", description = "Statistics",
            content = @Content(schema = @Schema(implementation = DisputeStatsDto.class)))
    @GetMapping("/stats")
    public ResponseEntity<DisputeStatsDto> stats(@PathVariable Long clinicId) {
        return ResponseEntity.ok(disputeService.disputeStats(clinicId));
    }
}
