package uk.gegc.antidote.features.dispute.api.dto;

import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;

import java.time.LocalDateTime;

public record DisputeStatusChangeDto(
        DisputeStatus fromStatus,
        DisputeStatus toStatus,
        String actor,
        String note,
        LocalDateTime changedAt
) {
}
