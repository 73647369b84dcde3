package uk.gegc.antidote.features.dispute.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeReason;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "LeadDispute")
public record DisputeDto(
        UUID id,
        Long leadId,
        Long clinicId,
        UUID originTransactionId,
        DisputeReason reason,
        String description,
        DisputeStatus status,
        DisputePriority priority,
        String adminNotes,
        String resolvedBy,
        @Schema(description = "Credits refunded; set only on approval")
        Long refundAmount,
        UUID refundTransactionId,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {
}
