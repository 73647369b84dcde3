package uk.gegc.antidote.features.dispute.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.antidote.BaseUnitTest;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.application.InternalBillingService;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DisputeServiceImpl")
class DisputeServiceImplTest extends BaseUnitTest {

    private static final Long CLINIC_ID = 5L;
    private static final Long LEAD_ID = 900L;

    @Mock private LeadDisputeRepository disputeRepository;
    @Mock private DisputeStatusChangeRepository statusChangeRepository;
    @Mock private DisputeMapper disputeMapper;
    @Mock private LedgerStore ledgerStore;
    @Mock private InternalBillingService internalBillingService;
    @Mock private AdminAccessPolicy adminAccessPolicy;

    private DisputeServiceImpl disputeService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        disputeService = new DisputeServiceImpl(disputeRepository, statusChangeRepository, disputeMapper,
                ledgerStore, internalBillingService, adminAccessPolicy, clock);
    }

    @Nested
    @DisplayName("fileDispute")
    class FileDispute {

        @Test
        @DisplayName("a charged lead can be disputed once; the filing is recorded in history")
        void filesDispute() {
            CreditTransaction charge = charge(-180L);
            when(ledgerStore.lockByIdempotencyKey("lead:5:900")).thenReturn(Optional.of(charge));
            when(disputeRepository.findByOriginTransactionId(charge.getId())).thenReturn(Optional.empty());
            when(disputeRepository.saveAndFlush(any(LeadDispute.class))).thenAnswer(inv -> {
                LeadDispute d = inv.getArgument(0);
                d.setId(UUID.randomUUID());
                return d;
            });

            disputeService.fileDispute(LEAD_ID, CLINIC_ID, DisputeReason.FAKE_OR_SPAM, "bot", null);

            ArgumentCaptor<LeadDispute> saved = ArgumentCaptor.forClass(LeadDispute.class);
            verify(disputeRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(DisputeStatus.PENDING);
            assertThat(saved.getValue().getPriority()).isEqualTo(DisputePriority.MEDIUM);
            assertThat(saved.getValue().getOriginTransactionId()).isEqualTo(charge.getId());

            ArgumentCaptor<DisputeStatusChange> change = ArgumentCaptor.forClass(DisputeStatusChange.class);
            verify(statusChangeRepository).save(change.capture());
            assertThat(change.getValue().getFromStatus()).isNull();
            assertThat(change.getValue().getToStatus()).isEqualTo(DisputeStatus.PENDING);
        }

        @Test
        @DisplayName("a lead the clinic was never charged for is not found")
        void noCharge() {
            when(ledgerStore.lockByIdempotencyKey("lead:5:900")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> disputeService.fileDispute(LEAD_ID, CLINIC_ID, DisputeReason.OTHER, null, null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("a pending dispute for the charge is a duplicate")
        void pendingDuplicate() {
            CreditTransaction charge = charge(-180L);
            when(ledgerStore.lockByIdempotencyKey("lead:5:900")).thenReturn(Optional.of(charge));
            when(disputeRepository.findByOriginTransactionId(charge.getId()))
                    .thenReturn(Optional.of(dispute(DisputeStatus.PENDING, charge.getId())));

            assertThatThrownBy(() -> disputeService.fileDispute(LEAD_ID, CLINIC_ID, DisputeReason.OTHER, null, null))
                    .isInstanceOf(DuplicateDisputeException.class);
            verify(disputeRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a resolved dispute cannot be refiled")
        void resolvedCannotRefile() {
            CreditTransaction charge = charge(-180L);
            when(ledgerStore.lockByIdempotencyKey("lead:5:900")).thenReturn(Optional.of(charge));
            when(disputeRepository.findByOriginTransactionId(charge.getId()))
                    .thenReturn(Optional.of(dispute(DisputeStatus.REJECTED, charge.getId())));

            assertThatThrownBy(() -> disputeService.fileDispute(LEAD_ID, CLINIC_ID, DisputeReason.OTHER, null, null))
                    .isInstanceOf(DisputeAlreadyResolvedException.class);
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("approval refunds the full charge by default")
        void approveFullRefund() {
            CreditTransaction charge = charge(-250L);
            LeadDispute dispute = dispute(DisputeStatus.PENDING, charge.getId());
            UUID refundId = UUID.randomUUID();
            when(adminAccessPolicy.currentActor()).thenReturn("admin-1");
            when(disputeRepository.findByIdForUpdate(dispute.getId())).thenReturn(Optional.of(dispute));
            when(ledgerStore.findTransaction(charge.getId())).thenReturn(Optional.of(charge));
            when(internalBillingService.creditRefund(eq(CLINIC_ID), eq(LEAD_ID), eq(250L), eq(dispute.getId()), anyString()))
                    .thenReturn(refundDto(refundId, 250L));
            when(disputeRepository.save(dispute)).thenReturn(dispute);

            disputeService.resolve(dispute.getId(), DisputeDecision.APPROVED, "valid complaint", null);

            assertThat(dispute.getStatus()).isEqualTo(DisputeStatus.APPROVED);
            assertThat(dispute.getRefundAmount()).isEqualTo(250L);
            assertThat(dispute.getRefundTransactionId()).isEqualTo(refundId);
            assertThat(dispute.getResolvedBy()).isEqualTo("admin-1");
            assertThat(dispute.getResolvedAt()).isNotNull();
            verify(adminAccessPolicy).requireAdmin(anyString());
        }

        @Test
        @DisplayName("a partial refund above the charge is rejected")
        void refundAboveCharge() {
            CreditTransaction charge = charge(-100L);
            LeadDispute dispute = dispute(DisputeStatus.PENDING, charge.getId());
            when(adminAccessPolicy.currentActor()).thenReturn("admin-1");
            when(disputeRepository.findByIdForUpdate(dispute.getId())).thenReturn(Optional.of(dispute));
            when(ledgerStore.findTransaction(charge.getId())).thenReturn(Optional.of(charge));

            assertThatThrownBy(() -> disputeService.resolve(dispute.getId(), DisputeDecision.APPROVED, null, 101L))
                    .isInstanceOf(InvalidInputException.class);
            verify(internalBillingService, never()).creditRefund(any(), any(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("rejection writes no ledger entry")
        void rejectNoRefund() {
            LeadDispute dispute = dispute(DisputeStatus.PENDING, UUID.randomUUID());
            when(adminAccessPolicy.currentActor()).thenReturn("admin-1");
            when(disputeRepository.findByIdForUpdate(dispute.getId())).thenReturn(Optional.of(dispute));
            when(disputeRepository.save(dispute)).thenReturn(dispute);

            disputeService.resolve(dispute.getId(), DisputeDecision.REJECTED, "lead was fine", null);

            assertThat(dispute.getStatus()).isEqualTo(DisputeStatus.REJECTED);
            assertThat(dispute.getRefundAmount()).isNull();
            verify(internalBillingService, never()).creditRefund(any(), any(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("rejection with a refund amount is invalid")
        void rejectWithRefundAmount() {
            LeadDispute dispute = dispute(DisputeStatus.PENDING, UUID.randomUUID());
            when(disputeRepository.findByIdForUpdate(dispute.getId())).thenReturn(Optional.of(dispute));

            assertThatThrownBy(() -> disputeService.resolve(dispute.getId(), DisputeDecision.REJECTED, null, 10L))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("a resolved dispute cannot be resolved again")
        void alreadyResolved() {
            LeadDispute dispute = dispute(DisputeStatus.APPROVED, UUID.randomUUID());
            when(disputeRepository.findByIdForUpdate(dispute.getId())).thenReturn(Optional.of(dispute));

            assertThatThrownBy(() -> disputeService.resolve(dispute.getId(), DisputeDecision.APPROVED, null, null))
                    .isInstanceOf(DisputeAlreadyResolvedException.class);
        }
    }

    private static CreditTransaction charge(long amount) {
        CreditTransaction tx = new CreditTransaction();
        tx.setId(UUID.randomUUID());
        tx.setClinicId(CLINIC_ID);
        tx.setLeadId(LEAD_ID);
        tx.setAmount(amount);
        tx.setKind(CreditTransactionKind.LEAD_DEDUCTION);
        tx.setStatus(CreditTransactionStatus.COMPLETED);
        return tx;
    }

    private static LeadDispute dispute(DisputeStatus status, UUID originTransactionId) {
        LeadDispute dispute = new LeadDispute();
        dispute.setId(UUID.randomUUID());
        dispute.setClinicId(CLINIC_ID);
        dispute.setLeadId(LEAD_ID);
        dispute.setOriginTransactionId(originTransactionId);
        dispute.setReason(DisputeReason.INVALID_CONTACT);
        dispute.setStatus(status);
        dispute.setPriority(DisputePriority.MEDIUM);
        return dispute;
    }

    private static TransactionDto refundDto(UUID id, long amount) {
        return new TransactionDto(id, CLINIC_ID, amount, CreditTransactionKind.REFUND, CreditTransactionStatus.COMPLETED,
                LEAD_ID, null, null, null, null, null, null);
    }
}
