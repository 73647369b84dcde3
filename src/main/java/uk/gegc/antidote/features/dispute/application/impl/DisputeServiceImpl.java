package uk.gegc.antidote.features.dispute.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.application.InternalBillingService;
import uk.gegc.antidote.features.billing.application.LedgerKeys;
import uk.gegc.antidote.features.dispute.api.dto.DisputeDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatsDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatusChangeDto;
import uk.gegc.antidote.features.dispute.application.DisputeService;
import uk.gegc.antidote.features.dispute.domain.exception.DisputeAlreadyResolvedException;
import uk.gegc.antidote.features.dispute.domain.exception.DuplicateDisputeException;
import uk.gegc.antidote.features.dispute.domain.model.DisputeDecision;
import uk.gegc.antidote.features.dispute.domain.model.DisputePriority;
import uk.gegc.antidote.features.dispute.domain.model.DisputeReason;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatus;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatusChange;
import uk.gegc.antidote.features.dispute.domain.model.LeadDispute;
import uk.gegc.antidote.features.dispute.infra.mapping.DisputeMapper;
import uk.gegc.antidote.features.dispute.infra.repository.DisputeStatusChangeRepository;
import uk.gegc.antidote.features.dispute.infra.repository.LeadDisputeRepository;
import uk.gegc.antidote.features.ledger.application.LedgerStore;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.exception.ResourceNotFoundException;
import uk.gegc.antidote.shared.security.AdminAccessPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DisputeServiceImpl implements DisputeService {

    private final LeadDisputeRepository disputeRepository;
    private final DisputeStatusChangeRepository statusChangeRepository;
    private final DisputeMapper disputeMapper;
    private final LedgerStore ledgerStore;
    private final InternalBillingService internalBillingService;
    private final AdminAccessPolicy adminAccessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public DisputeDto fileDispute(Long leadId, Long clinicId, DisputeReason reason, String description,
                                  DisputePriority priority) {
        if (leadId == null || clinicId == null || reason == null) {
            throw new InvalidInputException("leadId, clinicId and reason are required");
        }

        // the charge row lock serializes concurrent filings for the same lead
        CreditTransaction charge = ledgerStore.lockByIdempotencyKey(LedgerKeys.leadDeduction(clinicId, leadId))
                .filter(tx -> tx.getKind() == CreditTransactionKind.LEAD_DEDUCTION)
                .filter(tx -> tx.getStatus() == CreditTransactionStatus.COMPLETED)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No charge found for lead " + leadId + " and clinic " + clinicId));

        Optional<LeadDispute> existing = disputeRepository.findByOriginTransactionId(charge.getId());
        if (existing.isPresent()) {
            LeadDispute dispute = existing.get();
            if (dispute.getStatus() == DisputeStatus.PENDING) {
                throw new DuplicateDisputeException(
                        "Lead " + leadId + " already has a pending dispute", dispute.getId());
            }
            throw new DisputeAlreadyResolvedException(
                    "Dispute for lead " + leadId + " was already " + dispute.getStatus().name().toLowerCase(),
                    dispute.getId());
        }

        LeadDispute dispute = new LeadDispute();
        dispute.setLeadId(leadId);
        dispute.setClinicId(clinicId);
        dispute.setOriginTransactionId(charge.getId());
        dispute.setReason(reason);
        dispute.setDescription(description);
        dispute.setStatus(DisputeStatus.PENDING);
        dispute.setPriority(priority != null ? priority : DisputePriority.MEDIUM);
        dispute.setCreatedAt(now());
        LeadDispute saved = disputeRepository.saveAndFlush(dispute);

        recordChange(saved.getId(), null, DisputeStatus.PENDING, "clinic:" + clinicId, description);
        log.info("Dispute {} filed by clinic {} for lead {} ({})", saved.getId(), clinicId, leadId, reason);
        return disputeMapper.toDto(saved);
    }

    @Override
    @Transactional
    public DisputeDto resolve(UUID disputeId, DisputeDecision decision, String adminNotes, Long refundAmount) {
        adminAccessPolicy.requireAdmin("dispute resolution");
        if (disputeId == null || decision == null) {
            throw new InvalidInputException("disputeId and decision are required");
        }

        LeadDispute dispute = disputeRepository.findByIdForUpdate(disputeId)
                .orElseThrow(() -> new ResourceNotFoundException("Dispute " + disputeId + " not found"));
        if (dispute.getStatus() != DisputeStatus.PENDING) {
            throw new DisputeAlreadyResolvedException(
                    "Dispute " + disputeId + " is already " + dispute.getStatus().name().toLowerCase(), disputeId);
        }
        if (decision == DisputeDecision.REJECTED && refundAmount != null) {
            throw new InvalidInputException("A rejected dispute cannot carry a refund amount");
        }

        String actor = adminAccessPolicy.currentActor();
        if (decision == DisputeDecision.APPROVED) {
            CreditTransaction charge = ledgerStore.findTransaction(dispute.getOriginTransactionId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Charge " + dispute.getOriginTransactionId() + " not found"));
            long charged = Math.abs(charge.getAmount());
            long refund = refundAmount != null ? refundAmount : charged;
            if (refund < 1 || refund > charged) {
                throw new InvalidInputException("Refund amount must be between 1 and " + charged);
            }

            TransactionDto refundTx = internalBillingService.creditRefund(dispute.getClinicId(), dispute.getLeadId(),
                    refund, dispute.getId(), "Refund for disputed lead " + dispute.getLeadId());
            dispute.setRefundAmount(refund);
            dispute.setRefundTransactionId(refundTx.id());
        }

        DisputeStatus from = dispute.getStatus();
        dispute.setStatus(decision.toStatus());
        dispute.setAdminNotes(adminNotes);
        dispute.setResolvedBy(actor);
        dispute.setResolvedAt(now());
        LeadDispute saved = disputeRepository.save(dispute);

        recordChange(saved.getId(), from, saved.getStatus(), actor, adminNotes);
        log.info("Dispute {} {} by {} (refund={})", disputeId, saved.getStatus(), actor, saved.getRefundAmount());
        return disputeMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DisputeDto> listClinicDisputes(Long clinicId, DisputeStatus status) {
        return disputeMapper.toDtos(disputeRepository.findByClinic(clinicId, status));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DisputeDto> listDisputes(DisputeStatus status, DisputePriority priority) {
        adminAccessPolicy.requireAdmin("dispute listing");
        return disputeMapper.toDtos(disputeRepository.findByFilters(status, priority));
    }

    @Override
    @Transactional(readOnly = true)
    public DisputeStatsDto disputeStats(Long clinicId) {
        long pending = disputeRepository.countByClinicIdAndStatus(clinicId, DisputeStatus.PENDING);
        long approved = disputeRepository.countByClinicIdAndStatus(clinicId, DisputeStatus.APPROVED);
        long rejected = disputeRepository.countByClinicIdAndStatus(clinicId, DisputeStatus.REJECTED);
        return new DisputeStatsDto(clinicId, pending, approved, rejected, pending + approved + rejected);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DisputeStatusChangeDto> history(UUID disputeId) {
        if (!disputeRepository.existsById(disputeId)) {
            throw new ResourceNotFoundException("Dispute " + disputeId + " not found");
        }
        return disputeMapper.toChangeDtos(statusChangeRepository.findByDisputeIdOrderByChangedAtAsc(disputeId));
    }

    private void recordChange(UUID disputeId, DisputeStatus from, DisputeStatus to, String actor, String note) {
        DisputeStatusChange change = new DisputeStatusChange();
        change.setDisputeId(disputeId);
        change.setFromStatus(from);
        change.setToStatus(to);
        change.setActor(actor);
        change.setNote(note);
        change.setChangedAt(now());
        statusChangeRepository.save(change);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
