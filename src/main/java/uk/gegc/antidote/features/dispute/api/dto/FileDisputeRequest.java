package uk.gegc.antidote.features.dispute.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeReason;

@Schema(name = "FileDisputeRequest")
public record FileDisputeRequest(
        @NotNull
        @Schema(example = "4711")
        Long leadId,
        @NotNull
        DisputeReason reason,
        @Size(max = 2000)
        String description,
        @Schema(description = "Defaults to MEDIUM")
        DisputePriority priority
) {
}
