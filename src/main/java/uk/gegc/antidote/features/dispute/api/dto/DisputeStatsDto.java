package uk.gegc.antidote.features.dispute.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DisputeStats", description = "Dispute counts per status for one clinic")
public record DisputeStatsDto(
        Long clinicId,
        long pending,
        long approved,
        long rejected,
        long total
) {
}
