package uk.gegc.antidote.features.billing.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.antidote.BaseUnitTest;
import uk.gegc.antidote.features.billing.api.dto.DeductionResult;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.api.dto.TopUpOrderDto;
import uk.gegc.antidote.features.billing.api.dto.TopUpOutcome;
import uk.gegc.antidote.features.billing.api.dto.TransferResult;
import uk.gegc.antidote.features.billing.application.BillingProperties;
import uk.gegc.antidote.features.billing.domain.event.LowBalanceEvent;
import uk.gegc.antidote.features.billing.infra.mapping.CreditTransactionMapper;
import uk.gegc.antidote.features.ledger.application.LedgerEntry;
import uk.gegc.antidote.features.ledger.application.LedgerStore;
import uk.gegc.antidote.features.ledger.application.TransitionResult;
import uk.gegc.antidote.features.ledger.domain.exception.DuplicateLedgerEntryException;
import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;
import uk.gegc.antidote.features.payment.application.OrderHandle;
import uk.gegc.antidote.features.payment.application.PaymentGateway;
import uk.gegc.antidote.features.payment.domain.exception.SignatureMismatchException;
import uk.gegc.antidote.features.pricing.application.PricingEngine;
import uk.gegc.antidote.features.promo.application.PromoApplication;
import uk.gegc.antidote.features.promo.application.PromoEngine;
import uk.gegc.antidote.features.promo.domain.model.PromoUsage;
import uk.gegc.antidote.shared.exception.InsufficientPrivilegeException;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.exception.ResourceNotFoundException;
import uk.gegc.antidote.shared.metrics.BillingMetricsService;
import uk.gegc.antidote.shared.security.AdminAccessPolicy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("BillingServiceImpl")
class BillingServiceImplTest extends BaseUnitTest {

    private static final Long CLINIC_ID = 11L;
    private static final Long LEAD_ID = 501L;

    @Mock private LedgerStore ledgerStore;
    @Mock private PricingEngine pricingEngine;
    @Mock private PromoEngine promoEngine;
    @Mock private PaymentGateway paymentGateway;
    @Mock private CreditTransactionMapper transactionMapper;
    @Mock private AdminAccessPolicy adminAccessPolicy;
    @Mock private BillingMetricsService metricsService;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private TransactionTemplate transactionTemplate;

    private BillingProperties billingProperties;
    private BillingServiceImpl billingService;

    @BeforeEach
    void setUp() {
        billingProperties = new BillingProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        billingService = new BillingServiceImpl(billingProperties, ledgerStore, pricingEngine, promoEngine,
                paymentGateway, transactionMapper, adminAccessPolicy, metricsService, eventPublisher,
                transactionTemplate, new ObjectMapper(), clock);
    }

    @Nested
    @DisplayName("deductForLead")
    class DeductForLead {

        @Test
        @DisplayName("debits the band price and reports the new balance")
        void debitsPrice() {
            when(pricingEngine.priceFor(new BigDecimal("7500"))).thenReturn(180L);
            when(pricingEngine.version()).thenReturn("v1");
            when(ledgerStore.findByIdempotencyKey("lead:11:501")).thenReturn(Optional.empty());
            when(ledgerStore.append(any(LedgerEntry.class))).thenAnswer(inv -> completed(inv.getArgument(0), 820L));

            DeductionResult result = billingService.deductForLead(CLINIC_ID, LEAD_ID, new BigDecimal("7500"));

            assertThat(result.creditsDeducted()).isEqualTo(180L);
            assertThat(result.newBalance()).isEqualTo(820L);
            assertThat(result.duplicate()).isFalse();
            assertThat(result.lowBalance()).isFalse();

            ArgumentCaptor<LedgerEntry> entry = ArgumentCaptor.forClass(LedgerEntry.class);
            verify(ledgerStore).append(entry.capture());
            assertThat(entry.getValue().amount()).isEqualTo(-180L);
            assertThat(entry.getValue().kind()).isEqualTo(CreditTransactionKind.LEAD_DEDUCTION);
            assertThat(entry.getValue().idempotencyKey()).isEqualTo("lead:11:501");
            verify(ledgerStore).lockAccount(CLINIC_ID);
            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("a negative balance is allowed and raises a low-balance event")
        void negativeBalanceFlagsLow() {
            when(pricingEngine.priceFor(any())).thenReturn(180L);
            when(pricingEngine.version()).thenReturn("v1");
            when(ledgerStore.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
            when(ledgerStore.append(any(LedgerEntry.class))).thenAnswer(inv -> completed(inv.getArgument(0), -130L));

            DeductionResult result = billingService.deductForLead(CLINIC_ID, LEAD_ID, new BigDecimal("5000"));

            assertThat(result.newBalance()).isEqualTo(-130L);
            assertThat(result.lowBalance()).isTrue();
            ArgumentCaptor<LowBalanceEvent> event = ArgumentCaptor.forClass(LowBalanceEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().balance()).isEqualTo(-130L);
            verify(metricsService).recordLowBalance(CLINIC_ID, -130L);
        }

        @Test
        @DisplayName("a repeated lead returns the original charge without writing")
        void duplicateLead() {
            when(pricingEngine.priceFor(any())).thenReturn(180L);
            CreditTransaction original = transaction(-180L, CreditTransactionKind.LEAD_DEDUCTION,
                    CreditTransactionStatus.COMPLETED);
            original.setBalanceAfter(820L);
            when(ledgerStore.findByIdempotencyKey("lead:11:501")).thenReturn(Optional.of(original));

            DeductionResult result = billingService.deductForLead(CLINIC_ID, LEAD_ID, new BigDecimal("7500"));

            assertThat(result.duplicate()).isTrue();
            assertThat(result.transactionId()).isEqualTo(original.getId());
            assertThat(result.newBalance()).isEqualTo(820L);
            assertThat(result.creditsDeducted()).isEqualTo(180L);
            verify(ledgerStore, never()).append(any());
            verify(metricsService).recordDuplicateDeduction(CLINIC_ID);
        }

        @Test
        @DisplayName("missing identifiers are rejected before pricing")
        void missingIds() {
            assertThatThrownBy(() -> billingService.deductForLead(null, LEAD_ID, BigDecimal.TEN))
                    .isInstanceOf(InvalidInputException.class);
            verifyNoInteractions(pricingEngine, ledgerStore);
        }
    }

    @Nested
    @DisplayName("initiateTopUp")
    class InitiateTopUp {

        @Test
        @DisplayName("amounts outside the allowed range never reach the processor")
        void outOfRange() {
            assertThatThrownBy(() -> billingService.initiateTopUp(CLINIC_ID, 999, null))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> billingService.initiateTopUp(CLINIC_ID, 100001, null))
                    .isInstanceOf(InvalidInputException.class);
            verifyNoInteractions(paymentGateway);
        }

        @Test
        @DisplayName("charges the discounted amount and reserves the promo with the pending purchase")
        @SuppressWarnings("unchecked")
        void withPromo() {
            PromoApplication promo = new PromoApplication(UUID.randomUUID(), "WELCOME20", 5000, 1000, 4000, 100);
            when(ledgerStore.findAccount(CLINIC_ID)).thenReturn(Optional.empty());
            when(promoEngine.validate("welcome20", CLINIC_ID, 5000)).thenReturn(promo);
            when(paymentGateway.createOrder(eq(CLINIC_ID), eq(4000L), anyString()))
                    .thenReturn(new OrderHandle("order_1", 4000, "INR", "rzp_key", Map.of("order_id", "order_1")));
            when(transactionTemplate.execute(any()))
                    .thenAnswer(inv -> ((TransactionCallback<Object>) inv.getArgument(0)).doInTransaction(null));
            when(ledgerStore.append(any(LedgerEntry.class))).thenAnswer(inv -> {
                LedgerEntry entry = inv.getArgument(0);
                CreditTransaction tx = transaction(entry.amount(), entry.kind(), entry.status());
                tx.setExternalOrderId(entry.externalOrderId());
                return tx;
            });

            TopUpOrderDto order = billingService.initiateTopUp(CLINIC_ID, 5000, "welcome20");

            assertThat(order.orderId()).isEqualTo("order_1");
            assertThat(order.credits()).isEqualTo(5000L);
            assertThat(order.chargeAmount()).isEqualTo(4000L);
            assertThat(order.discount()).isEqualTo(1000L);
            assertThat(order.bonusCredits()).isEqualTo(100L);

            ArgumentCaptor<LedgerEntry> entry = ArgumentCaptor.forClass(LedgerEntry.class);
            verify(ledgerStore).append(entry.capture());
            assertThat(entry.getValue().status()).isEqualTo(CreditTransactionStatus.PENDING);
            assertThat(entry.getValue().amount()).isEqualTo(5000L);
            assertThat(entry.getValue().idempotencyKey()).isEqualTo("order:order_1");
            verify(promoEngine).reserve(eq(promo), eq(CLINIC_ID), eq(order.transactionId()));
        }
    }

    @Nested
    @DisplayName("confirmTopUp")
    class ConfirmTopUp {

        @Test
        @DisplayName("a tampered signature fails the pending purchase, releases the promo and never credits")
        void tamperedSignature() {
            CreditTransaction purchase = transaction(5000L, CreditTransactionKind.PURCHASE, CreditTransactionStatus.PENDING);
            when(paymentGateway.verifyCallback("order_1", "pay_1", "bad")).thenReturn(false);
            when(ledgerStore.lockByIdempotencyKey("order:order_1")).thenReturn(Optional.of(purchase));
            when(ledgerStore.fail(eq(purchase.getId()), anyString())).thenReturn(new TransitionResult(purchase, true));

            assertThatThrownBy(() -> billingService.confirmTopUp("order_1", "pay_1", "bad"))
                    .isInstanceOf(SignatureMismatchException.class);

            verify(ledgerStore, never()).complete(any(), any());
            verify(promoEngine).release(purchase.getId());
            verify(metricsService).recordSignatureMismatch("callback");
        }

        @Test
        @DisplayName("a verified pending purchase is completed and its promo bonus credited")
        void completesWithBonus() {
            CreditTransaction purchase = transaction(5000L, CreditTransactionKind.PURCHASE, CreditTransactionStatus.PENDING);
            purchase.setExternalOrderId("order_1");
            CreditTransaction completedPurchase = transaction(5000L, CreditTransactionKind.PURCHASE,
                    CreditTransactionStatus.COMPLETED);
            completedPurchase.setBalanceAfter(5050L);
            PromoUsage usage = new PromoUsage();
            usage.setBonusCredits(100);

            when(paymentGateway.verifyCallback("order_1", "pay_1", "good")).thenReturn(true);
            when(ledgerStore.lockByIdempotencyKey("order:order_1")).thenReturn(Optional.of(purchase));
            when(ledgerStore.complete(purchase.getId(), "pay_1")).thenReturn(new TransitionResult(completedPurchase, true));
            when(promoEngine.redeem(purchase.getId())).thenReturn(Optional.of(usage));
            when(ledgerStore.append(any(LedgerEntry.class))).thenAnswer(inv -> completed(inv.getArgument(0), 5150L));

            TopUpConfirmation confirmation = billingService.confirmTopUp("order_1", "pay_1", "good");

            assertThat(confirmation.outcome()).isEqualTo(TopUpOutcome.CREDITED);
            assertThat(confirmation.creditedAmount()).isEqualTo(5000L);
            assertThat(confirmation.bonusCredits()).isEqualTo(100L);
            assertThat(confirmation.newBalance()).isEqualTo(5150L);
            assertThat(confirmation.duplicate()).isFalse();

            ArgumentCaptor<LedgerEntry> bonus = ArgumentCaptor.forClass(LedgerEntry.class);
            verify(ledgerStore).append(bonus.capture());
            assertThat(bonus.getValue().kind()).isEqualTo(CreditTransactionKind.PROMO_BONUS);
            assertThat(bonus.getValue().idempotencyKey()).isEqualTo("order:order_1:bonus");
        }

        @Test
        @DisplayName("a failed purchase is never credited by a late payment")
        void failedPurchaseNotCredited() {
            CreditTransaction purchase = transaction(5000L, CreditTransactionKind.PURCHASE, CreditTransactionStatus.FAILED);
            purchase.setExternalOrderId("order_1");
            when(paymentGateway.verifyCallback("order_1", "pay_1", "good")).thenReturn(true);
            when(ledgerStore.lockByIdempotencyKey("order:order_1")).thenReturn(Optional.of(purchase));

            TopUpConfirmation confirmation = billingService.confirmTopUp("order_1", "pay_1", "good");

            assertThat(confirmation.outcome()).isEqualTo(TopUpOutcome.PAYMENT_NOT_VERIFIED);
            assertThat(confirmation.creditedAmount()).isZero();
            verify(ledgerStore, never()).complete(any(), any());
            verify(metricsService).recordPaymentForFailedPurchase(CLINIC_ID);
        }
    }

    @Nested
    @DisplayName("admin operations")
    class AdminOperations {

        @Test
        @DisplayName("adjustBalance requires administrator privilege")
        void adjustRequiresAdmin() {
            doCallRealMethod().when(adminAccessPolicy).requireAdmin(anyString());
            when(adminAccessPolicy.isAdmin()).thenReturn(false);

            assertThatThrownBy(() -> billingService.adjustBalance(CLINIC_ID, 100, "goodwill", null))
                    .isInstanceOf(InsufficientPrivilegeException.class);
            verifyNoInteractions(ledgerStore);
        }

        @Test
        @DisplayName("adjustBalance rejects a zero amount")
        void adjustRejectsZero() {
            assertThatThrownBy(() -> billingService.adjustBalance(CLINIC_ID, 0, "nothing", "k1"))
                    .isInstanceOf(InvalidInputException.class);
            verify(metricsService, never()).recordAdjustment(any(), anyLong());
        }
    }

    @Nested
    @DisplayName("transferCredits")
    class TransferCredits {

        private static final Long SOURCE_ID = 20L;

        @Test
        @DisplayName("locks both accounts in ascending id order and writes a debit and a credit")
        void writesBothLegs() {
            ClinicAccount source = account(SOURCE_ID, 1_000L);
            when(ledgerStore.findAccount(SOURCE_ID)).thenReturn(Optional.of(source));
            when(ledgerStore.lockAccount(CLINIC_ID)).thenReturn(account(CLINIC_ID, 0L));
            when(ledgerStore.lockAccount(SOURCE_ID)).thenReturn(source);
            when(ledgerStore.findByIdempotencyKey("transfer:t1:out")).thenReturn(Optional.empty());
            when(ledgerStore.append(any(LedgerEntry.class))).thenAnswer(inv -> completed(inv.getArgument(0), 0L));

            TransferResult result = billingService.transferCredits(SOURCE_ID, CLINIC_ID, 300, " merger ", "t1");

            assertThat(result.duplicate()).isFalse();
            InOrder locks = inOrder(ledgerStore);
            locks.verify(ledgerStore).lockAccount(CLINIC_ID);
            locks.verify(ledgerStore).lockAccount(SOURCE_ID);

            ArgumentCaptor<LedgerEntry> entries = ArgumentCaptor.forClass(LedgerEntry.class);
            verify(ledgerStore, times(2)).append(entries.capture());
            LedgerEntry debit = entries.getAllValues().get(0);
            LedgerEntry credit = entries.getAllValues().get(1);
            assertThat(debit.clinicId()).isEqualTo(SOURCE_ID);
            assertThat(debit.amount()).isEqualTo(-300L);
            assertThat(debit.idempotencyKey()).isEqualTo("transfer:t1:out");
            assertThat(debit.description()).isEqualTo("Transfer to clinic 11: merger");
            assertThat(credit.clinicId()).isEqualTo(CLINIC_ID);
            assertThat(credit.amount()).isEqualTo(300L);
            assertThat(credit.kind()).isEqualTo(CreditTransactionKind.ADMIN_ADJUSTMENT);
            assertThat(credit.status()).isEqualTo(CreditTransactionStatus.COMPLETED);
            verify(metricsService).recordAdjustment(SOURCE_ID, -300L);
            verify(metricsService).recordAdjustment(CLINIC_ID, 300L);
        }

        @Test
        @DisplayName("rejects a transfer to the same clinic")
        void sameClinicRejected() {
            assertThatThrownBy(() -> billingService.transferCredits(CLINIC_ID, CLINIC_ID, 300, "oops", null))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("same clinic");
            verifyNoInteractions(ledgerStore);
        }

        @Test
        @DisplayName("rejects a transfer the source balance cannot cover")
        void insufficientCredits() {
            ClinicAccount source = account(SOURCE_ID, 100L);
            when(ledgerStore.findAccount(SOURCE_ID)).thenReturn(Optional.of(source));
            when(ledgerStore.lockAccount(CLINIC_ID)).thenReturn(account(CLINIC_ID, 0L));
            when(ledgerStore.lockAccount(SOURCE_ID)).thenReturn(source);
            when(ledgerStore.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> billingService.transferCredits(SOURCE_ID, CLINIC_ID, 300, "merger", "t2"))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("Insufficient credits");
            verify(ledgerStore, never()).append(any());
        }

        @Test
        @DisplayName("fails with not found when the source clinic has no account")
        void unknownSource() {
            when(ledgerStore.findAccount(SOURCE_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> billingService.transferCredits(SOURCE_ID, CLINIC_ID, 300, "merger", "t3"))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(ledgerStore, never()).lockAccount(any());
        }

        @Test
        @DisplayName("a repeated idempotency key returns the original legs without writing")
        void repeatedKeyIsDuplicate() {
            ClinicAccount source = account(SOURCE_ID, 700L);
            CreditTransaction debit = transaction(-300L, CreditTransactionKind.ADMIN_ADJUSTMENT, CreditTransactionStatus.COMPLETED);
            debit.setClinicId(SOURCE_ID);
            CreditTransaction credit = transaction(300L, CreditTransactionKind.ADMIN_ADJUSTMENT, CreditTransactionStatus.COMPLETED);
            when(ledgerStore.findAccount(SOURCE_ID)).thenReturn(Optional.of(source));
            when(ledgerStore.lockAccount(CLINIC_ID)).thenReturn(account(CLINIC_ID, 300L));
            when(ledgerStore.lockAccount(SOURCE_ID)).thenReturn(source);
            when(ledgerStore.findByIdempotencyKey("transfer:t4:out")).thenReturn(Optional.of(debit));
            when(ledgerStore.findByIdempotencyKey("transfer:t4:in")).thenReturn(Optional.of(credit));

            TransferResult result = billingService.transferCredits(SOURCE_ID, CLINIC_ID, 300, "merger", "t4");

            assertThat(result.duplicate()).isTrue();
            verify(ledgerStore, never()).append(any());
            verify(metricsService, never()).recordAdjustment(any(), anyLong());
        }

        @Test
        @DisplayName("a key reused for a different amount is a constraint violation")
        void reusedKeyDifferentAmount() {
            ClinicAccount source = account(SOURCE_ID, 700L);
            CreditTransaction debit = transaction(-300L, CreditTransactionKind.ADMIN_ADJUSTMENT, CreditTransactionStatus.COMPLETED);
            debit.setClinicId(SOURCE_ID);
            when(ledgerStore.findAccount(SOURCE_ID)).thenReturn(Optional.of(source));
            when(ledgerStore.lockAccount(CLINIC_ID)).thenReturn(account(CLINIC_ID, 300L));
            when(ledgerStore.lockAccount(SOURCE_ID)).thenReturn(source);
            when(ledgerStore.findByIdempotencyKey("transfer:t5:out")).thenReturn(Optional.of(debit));
            when(ledgerStore.findByIdempotencyKey("transfer:t5:in")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> billingService.transferCredits(SOURCE_ID, CLINIC_ID, 500, "merger", "t5"))
                    .isInstanceOf(DuplicateLedgerEntryException.class);
        }
    }

    private static ClinicAccount account(Long clinicId, long balance) {
        ClinicAccount account = new ClinicAccount();
        account.setClinicId(clinicId);
        account.setBalance(balance);
        account.setActive(true);
        return account;
    }

    private static CreditTransaction transaction(long amount, CreditTransactionKind kind, CreditTransactionStatus status) {
        CreditTransaction tx = new CreditTransaction();
        tx.setId(UUID.randomUUID());
        tx.setClinicId(CLINIC_ID);
        tx.setAmount(amount);
        tx.setKind(kind);
        tx.setStatus(status);
        return tx;
    }

    private static CreditTransaction completed(LedgerEntry entry, long balanceAfter) {
        CreditTransaction tx = transaction(entry.amount(), entry.kind(), entry.status());
        tx.setIdempotencyKey(entry.idempotencyKey());
        tx.setBalanceAfter(balanceAfter);
        return tx;
    }
}
