package uk.gegc.antidote.features.dispute.application;

import uk.gegc.antidote.features.dispute.api.dto.DisputeDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatsDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatusChangeDto;
import uk.gegc.antidote.features.dispute.domain.model.DisputeDecision;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeReason;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;

import java.util.List;
import java.util.UUID;

/**
 * Lead charge disputes. A charge can be disputed once; an approved dispute is refunded through the billing
 * service in the same transaction as the status change.
 */
public interface DisputeService {

    /**
     * @throws uk.gegc.antidote.shared.exception.ResourceNotFoundException if the clinic was never charged for the lead
     * @throws uk.gegc.antidote.features.dispute.domain.exception.DuplicateDisputeException if a dispute is pending
     * @throws uk.gegc.antidote.features.dispute.domain.exception.DisputeAlreadyResolvedException if a dispute for
     *         the charge was already resolved
     */
    DisputeDto fileDispute(Long leadId, Long clinicId, DisputeReason reason, String description,
                           DisputePriority priority);

    /**
     * Admin only. {@code refundAmount} applies to approvals and defaults to the full charge.
     */
    DisputeDto resolve(UUID disputeId, DisputeDecision decision, String adminNotes, Long refundAmount);

    List<DisputeDto> listClinicDisputes(Long clinicId, DisputeStatus status);

    /**
     * Admin review queue, oldest first.
     */
    List<DisputeDto> listDisputes(DisputeStatus status, DisputePriority priority);

    DisputeStatsDto disputeStats(Long clinicId);

    List<DisputeStatusChangeDto> history(UUID disputeId);
}
