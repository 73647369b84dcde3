package uk.gegc.antidote.features.dispute.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import uk.gegc.antidote.features.dispute.domain.model.DisputeDecision;

@Schema(name = "ResolveDisputeRequest")
public record ResolveDisputeRequest(
        @NotNull
        DisputeDecision decision,
        @Size(max = 2000)
        String adminNotes,
        @Positive
        @Schema(description = "Credits to refund on approval; defaults to the full charge")
        Long refundAmount
) {
}
