package uk.gegc.antidote.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import uk.gegc.antidote.features.billing.api.dto.BalanceDto;
import uk.gegc.antidote.features.billing.api.dto.DeductionResult;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.api.dto.TopUpOrderDto;
import uk.gegc.antidote.features.billing.api.dto.TopUpOutcome;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.api.dto.TransactionPageDto;
import uk.gegc.antidote.features.billing.api.dto.TransferResult;
import uk.gegc.antidote.features.billing.application.BillingProperties;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.billing.application.InternalBillingService;
import uk.gegc.antidote.features.billing.application.LedgerKeys;
import uk.gegc.antidote.features.billing.domain.event.LowBalanceEvent;
import uk.gegc.antidote.features.billing.infra.mapping.CreditTransactionMapper;
import uk.gegc.antidote.features.ledger.application.LedgerEntry;
import uk.gegc.antidote.features.ledger.application.LedgerPage;
import uk.gegc.antidote.features.ledger.application.LedgerStore;
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
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.exception.ResourceNotFoundException;
import uk.gegc.antidote.shared.metrics.BillingMetricsService;
import uk.gegc.antidote.shared.security.AdminAccessPolicy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BillingServiceImpl implements BillingService, InternalBillingService {

    private static final int MAX_TRANSFER_REASON = 400;

    private final BillingProperties billingProperties;
    private final LedgerStore ledgerStore;
    private final PricingEngine pricingEngine;
    private final PromoEngine promoEngine;
    private final PaymentGateway paymentGateway;
    private final CreditTransactionMapper transactionMapper;
    private final AdminAccessPolicy adminAccessPolicy;
    private final BillingMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public BalanceDto openAccount(Long clinicId) {
        adminAccessPolicy.requireAdmin("account opening");
        return toBalanceDto(ledgerStore.openAccount(clinicId));
    }

    @Override
    @Transactional
    public void deactivateAccount(Long clinicId) {
        adminAccessPolicy.requireAdmin("account deactivation");
        ledgerStore.deactivateAccount(clinicId);
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(Long clinicId) {
        return ledgerStore.findAccount(clinicId)
                .map(this::toBalanceDto)
                .orElseGet(() -> new BalanceDto(clinicId, 0L, isLow(0L), false, null));
    }

    @Override
    @Transactional(readOnly = true)
    public TransactionPageDto listTransactions(Long clinicId, String pageToken, int size, CreditTransactionKind kind) {
        LedgerPage page = ledgerStore.listTransactions(clinicId, pageToken, size, kind);
        return new TransactionPageDto(transactionMapper.toDtos(page.entries()), page.nextPageToken());
    }

    // ==================== Lead deductions ====================

    @Override
    @Transactional
    public DeductionResult deductForLead(Long clinicId, Long leadId, BigDecimal packageValue) {
        if (clinicId == null || leadId == null) {
            throw new InvalidInputException("clinicId and leadId are required");
        }
        long cost = pricingEngine.priceFor(packageValue);
        String key = LedgerKeys.leadDeduction(clinicId, leadId);

        // the account lock orders concurrent deliveries of the same lead behind this check
        ledgerStore.lockAccount(clinicId);
        Optional<CreditTransaction> existing = ledgerStore.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            CreditTransaction tx = existing.get();
            long balanceAfter = tx.getBalanceAfter() != null ? tx.getBalanceAfter() : ledgerStore.getBalance(clinicId);
            metricsService.recordDuplicateDeduction(clinicId);
            log.info("Lead {} for clinic {} already billed by {}", leadId, clinicId, tx.getId());
            return new DeductionResult(tx.getId(), clinicId, leadId, -tx.getAmount(), balanceAfter,
                    isLow(balanceAfter), true);
        }

        CreditTransaction tx = ledgerStore.append(LedgerEntry.builder()
                .clinicId(clinicId)
                .amount(-cost)
                .kind(CreditTransactionKind.LEAD_DEDUCTION)
                .status(CreditTransactionStatus.COMPLETED)
                .idempotencyKey(key)
                .leadId(leadId)
                .description("Lead " + leadId)
                .metaJson(buildMetaJson(Map.of(
                        "packageValue", packageValue.toPlainString(),
                        "priceTable", pricingEngine.version())))
                .build());

        long balanceAfter = tx.getBalanceAfter();
        boolean lowBalance = isLow(balanceAfter);
        metricsService.recordLeadDeduction(clinicId, cost);
        if (lowBalance) {
            metricsService.recordLowBalance(clinicId, balanceAfter);
            log.warn("Clinic {} is below the low-balance threshold after lead {}: balance={}",
                    clinicId, leadId, balanceAfter);
            eventPublisher.publishEvent(new LowBalanceEvent(
                    clinicId, balanceAfter, billingProperties.getLowBalanceThreshold(), leadId));
        }
        return new DeductionResult(tx.getId(), clinicId, leadId, cost, balanceAfter, lowBalance, false);
    }

    // ==================== Top-ups ====================

    @Override
    public TopUpOrderDto initiateTopUp(Long clinicId, long amount, String promoCode) {
        if (clinicId == null) {
            throw new InvalidInputException("clinicId is required");
        }
        if (amount < billingProperties.getMinTopUp() || amount > billingProperties.getMaxTopUp()) {
            throw new InvalidInputException("Top-up amount must be between " + billingProperties.getMinTopUp()
                    + " and " + billingProperties.getMaxTopUp() + " credits");
        }
        ledgerStore.findAccount(clinicId)
                .filter(account -> !account.isActive())
                .ifPresent(account -> {
                    throw new InvalidInputException("Clinic account " + clinicId + " is deactivated");
                });

        PromoApplication promo = StringUtils.hasText(promoCode)
                ? promoEngine.validate(promoCode, clinicId, amount)
                : null;
        long chargeAmount = promo != null ? promo.chargeAmount() : amount;
        String reference = "topup-" + clinicId + "-" + clock.millis();

        // external call stays outside any database transaction
        OrderHandle order = paymentGateway.createOrder(clinicId, chargeAmount, reference);

        TopUpOrderDto result = transactionTemplate.execute(status -> {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("reference", reference);
            meta.put("chargeAmount", chargeAmount);
            meta.put("currency", order.currency());
            if (promo != null) {
                meta.put("promoCode", promo.code());
                meta.put("discount", promo.discount());
                meta.put("bonusCredits", promo.bonusCredits());
            }

            CreditTransaction pending = ledgerStore.append(LedgerEntry.builder()
                    .clinicId(clinicId)
                    .amount(amount)
                    .kind(CreditTransactionKind.PURCHASE)
                    .status(CreditTransactionStatus.PENDING)
                    .idempotencyKey(LedgerKeys.purchase(order.orderId()))
                    .externalOrderId(order.orderId())
                    .refId(promo != null ? promo.code() : null)
                    .description("Credit top-up")
                    .metaJson(buildMetaJson(meta))
                    .build());

            if (promo != null) {
                promoEngine.reserve(promo, clinicId, pending.getId());
            }
            return new TopUpOrderDto(
                    pending.getId(),
                    order.orderId(),
                    amount,
                    chargeAmount,
                    promo != null ? promo.discount() : 0L,
                    promo != null ? promo.bonusCredits() : 0L,
                    promo != null ? promo.code() : null,
                    order.currency(),
                    order.publicKey(),
                    order.checkoutParams());
        });

        metricsService.recordTopUpInitiated(clinicId, amount);
        log.info("Initiated top-up for clinic {}: order={}, credits={}, charge={}",
                clinicId, order.orderId(), amount, chargeAmount);
        return result;
    }

    @Override
    @Transactional(noRollbackFor = SignatureMismatchException.class)
    public TopUpConfirmation confirmTopUp(String orderId, String paymentId, String signature) {
        if (!StringUtils.hasText(orderId)) {
            throw new InvalidInputException("orderId is required");
        }
        boolean verified = paymentGateway.verifyCallback(orderId, paymentId, signature);
        Optional<CreditTransaction> purchaseOpt = ledgerStore.lockByIdempotencyKey(LedgerKeys.purchase(orderId));

        if (!verified) {
            metricsService.recordSignatureMismatch("callback");
            log.warn("Rejected payment callback for order {} (payment {}): signature mismatch", orderId, paymentId);
            purchaseOpt.filter(CreditTransaction::isPending)
                    .ifPresent(purchase -> failPurchase(purchase, "Payment signature mismatch"));
            throw new SignatureMismatchException("Payment signature could not be verified for order " + orderId);
        }

        CreditTransaction purchase = purchaseOpt
                .orElseThrow(() -> new ResourceNotFoundException("No purchase for order " + orderId));
        return settleVerifiedPurchase(purchase, paymentId);
    }

    @Override
    @Transactional
    public Optional<TopUpConfirmation> completeVerifiedPayment(String orderId, String paymentId) {
        if (!StringUtils.hasText(orderId) || !StringUtils.hasText(paymentId)) {
            throw new InvalidInputException("orderId and paymentId are required");
        }
        return ledgerStore.lockByIdempotencyKey(LedgerKeys.purchase(orderId))
                .map(purchase -> settleVerifiedPurchase(purchase, paymentId));
    }

    @Override
    @Transactional
    public boolean failPendingPurchase(String orderId, String reason) {
        return ledgerStore.lockByIdempotencyKey(LedgerKeys.purchase(orderId))
                .filter(CreditTransaction::isPending)
                .map(purchase -> failPurchase(purchase, reason))
                .orElse(false);
    }

    /**
     * Periodic sweep of unconfirmed purchases.
     */
    @Scheduled(fixedDelayString = "${billing.pending-sweep-interval-ms:300000}",
               initialDelayString = "${billing.pending-sweep-interval-ms:300000}")
    public void sweepStalePurchases() {
        try {
            expireStalePurchases();
        } catch (RuntimeException e) {
            log.error("Pending purchase sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public int expireStalePurchases() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(billingProperties.getPendingPurchaseTtl());
        List<UUID> candidates = ledgerStore.findPendingPurchasesCreatedBefore(cutoff);
        if (candidates.isEmpty()) {
            return 0;
        }

        int expired = 0;
        for (UUID purchaseId : candidates) {
            try {
                Boolean failed = transactionTemplate.execute(status -> ledgerStore.lockTransaction(purchaseId)
                        .filter(CreditTransaction::isPending)
                        .map(purchase -> failPurchase(purchase, "Payment not confirmed within "
                                + billingProperties.getPendingPurchaseTtl()))
                        .orElse(false));
                if (Boolean.TRUE.equals(failed)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire pending purchase {}: {}", purchaseId, e.getMessage(), e);
            }
        }

        if (expired > 0) {
            metricsService.recordPurchasesExpired(expired);
            log.info("Expired {} stale pending purchases older than {}", expired, cutoff);
        }
        return expired;
    }

    // ==================== Adjustments & refunds ====================

    @Override
    @Transactional
    public TransactionDto adjustBalance(Long clinicId, long amount, String reason, String idempotencyKey) {
        adminAccessPolicy.requireAdmin("balance adjustment");
        if (clinicId == null) {
            throw new InvalidInputException("clinicId is required");
        }
        if (amount == 0) {
            throw new InvalidInputException("Adjustment amount must be non-zero");
        }
        if (!StringUtils.hasText(reason)) {
            throw new InvalidInputException("A reason is required for balance adjustments");
        }
        String adminId = adminAccessPolicy.currentActor();
        String key = LedgerKeys.adjustment(StringUtils.hasText(idempotencyKey)
                ? idempotencyKey.trim()
                : UUID.randomUUID().toString());

        ledgerStore.lockAccount(clinicId);
        Optional<CreditTransaction> existing = ledgerStore.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            CreditTransaction tx = existing.get();
            if (!Objects.equals(tx.getClinicId(), clinicId) || tx.getAmount() != amount) {
                throw new DuplicateLedgerEntryException(
                        "Idempotency key " + idempotencyKey + " was used for a different adjustment", key);
            }
            return transactionMapper.toDto(tx);
        }

        CreditTransaction tx = ledgerStore.append(LedgerEntry.builder()
                .clinicId(clinicId)
                .amount(amount)
                .kind(CreditTransactionKind.ADMIN_ADJUSTMENT)
                .status(CreditTransactionStatus.COMPLETED)
                .idempotencyKey(key)
                .refId(adminId)
                .description(reason.trim())
                .build());
        metricsService.recordAdjustment(clinicId, amount);
        log.info("Admin {} adjusted clinic {} by {}: {}", adminId, clinicId, amount, reason);
        return transactionMapper.toDto(tx);
    }

    @Override
    @Transactional
    public TransferResult transferCredits(Long fromClinicId, Long toClinicId, long amount, String reason,
                                          String idempotencyKey) {
        adminAccessPolicy.requireAdmin("credit transfer");
        if (fromClinicId == null || toClinicId == null) {
            throw new InvalidInputException("Source and destination clinics are required");
        }
        if (fromClinicId.equals(toClinicId)) {
            throw new InvalidInputException("Cannot transfer credits to the same clinic");
        }
        if (amount <= 0) {
            throw new InvalidInputException("Transfer amount must be positive");
        }
        if (!StringUtils.hasText(reason) || reason.trim().length() > MAX_TRANSFER_REASON) {
            throw new InvalidInputException("A reason of at most " + MAX_TRANSFER_REASON + " characters is required");
        }
        if (ledgerStore.findAccount(fromClinicId).isEmpty()) {
            throw new ResourceNotFoundException("Account for clinic " + fromClinicId + " not found");
        }
        String adminId = adminAccessPolicy.currentActor();
        String clientKey = StringUtils.hasText(idempotencyKey) ? idempotencyKey.trim() : UUID.randomUUID().toString();
        String outKey = LedgerKeys.transferOut(clientKey);
        String inKey = LedgerKeys.transferIn(clientKey);

        // ascending clinic id, so opposite transfers between the same pair cannot deadlock
        ClinicAccount first = ledgerStore.lockAccount(Math.min(fromClinicId, toClinicId));
        ClinicAccount second = ledgerStore.lockAccount(Math.max(fromClinicId, toClinicId));
        ClinicAccount source = first.getClinicId().equals(fromClinicId) ? first : second;

        Optional<CreditTransaction> existingDebit = ledgerStore.findByIdempotencyKey(outKey);
        if (existingDebit.isPresent()) {
            CreditTransaction debit = existingDebit.get();
            CreditTransaction credit = ledgerStore.findByIdempotencyKey(inKey).orElse(null);
            if (!Objects.equals(debit.getClinicId(), fromClinicId) || debit.getAmount() != -amount
                    || credit == null || !Objects.equals(credit.getClinicId(), toClinicId)) {
                throw new DuplicateLedgerEntryException(
                        "Idempotency key " + idempotencyKey + " was used for a different transfer", outKey);
            }
            return new TransferResult(transactionMapper.toDto(debit), transactionMapper.toDto(credit), true);
        }

        if (source.getBalance() < amount) {
            throw new InvalidInputException("Insufficient credits in clinic " + fromClinicId
                    + ": balance " + source.getBalance() + ", transfer " + amount);
        }

        String trimmed = reason.trim();
        CreditTransaction debit = ledgerStore.append(LedgerEntry.builder()
                .clinicId(fromClinicId)
                .amount(-amount)
                .kind(CreditTransactionKind.ADMIN_ADJUSTMENT)
                .status(CreditTransactionStatus.COMPLETED)
                .idempotencyKey(outKey)
                .refId(adminId)
                .description("Transfer to clinic " + toClinicId + ": " + trimmed)
                .build());
        CreditTransaction credit = ledgerStore.append(LedgerEntry.builder()
                .clinicId(toClinicId)
                .amount(amount)
                .kind(CreditTransactionKind.ADMIN_ADJUSTMENT)
                .status(CreditTransactionStatus.COMPLETED)
                .idempotencyKey(inKey)
                .refId(adminId)
                .description("Transfer from clinic " + fromClinicId + ": " + trimmed)
                .build());
        metricsService.recordAdjustment(fromClinicId, -amount);
        metricsService.recordAdjustment(toClinicId, amount);
        log.info("Admin {} transferred {} credits from clinic {} to clinic {}: {}",
                adminId, amount, fromClinicId, toClinicId, trimmed);
        return new TransferResult(transactionMapper.toDto(debit), transactionMapper.toDto(credit), false);
    }

    @Override
    @Transactional
    public TransactionDto creditRefund(Long clinicId, Long leadId, long amount, UUID disputeId, String reason) {
        if (amount <= 0) {
            throw new InvalidInputException("Refund amount must be positive");
        }
        String key = LedgerKeys.disputeRefund(disputeId);
        ledgerStore.lockAccount(clinicId);
        Optional<CreditTransaction> existing = ledgerStore.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            return transactionMapper.toDto(existing.get());
        }

        CreditTransaction tx = ledgerStore.append(LedgerEntry.builder()
                .clinicId(clinicId)
                .amount(amount)
                .kind(CreditTransactionKind.REFUND)
                .status(CreditTransactionStatus.COMPLETED)
                .idempotencyKey(key)
                .leadId(leadId)
                .refId(disputeId.toString())
                .description(reason)
                .build());
        metricsService.recordRefund(clinicId, amount);
        return transactionMapper.toDto(tx);
    }

    // ==================== Helpers ====================

    /**
     * Settles a purchase whose payment has been verified. The purchase row must be locked by the caller.
     */
    private TopUpConfirmation settleVerifiedPurchase(CreditTransaction purchase, String paymentId) {
        String orderId = purchase.getExternalOrderId();
        switch (purchase.getStatus()) {
            case COMPLETED -> {
                if (!Objects.equals(paymentId, purchase.getExternalPaymentId())) {
                    throw new DuplicateLedgerEntryException("Order " + orderId
                            + " was already completed with a different payment", purchase.getIdempotencyKey());
                }
                Optional<CreditTransaction> bonus = ledgerStore.findByIdempotencyKey(LedgerKeys.promoBonus(orderId));
                long balanceAfter = bonus.map(CreditTransaction::getBalanceAfter).orElse(purchase.getBalanceAfter());
                log.info("Duplicate confirmation for order {} (payment {})", orderId, paymentId);
                return new TopUpConfirmation(purchase.getId(), purchase.getClinicId(), orderId, paymentId,
                        TopUpOutcome.CREDITED, purchase.getAmount(), bonus.map(CreditTransaction::getAmount).orElse(0L),
                        balanceAfter, true);
            }
            case PENDING -> {
                CreditTransaction completed = ledgerStore.complete(purchase.getId(), paymentId).transaction();
                long balanceAfter = completed.getBalanceAfter();
                long bonusCredits = 0L;

                Optional<PromoUsage> usage = promoEngine.redeem(purchase.getId());
                if (usage.isPresent() && usage.get().getBonusCredits() > 0) {
                    CreditTransaction bonus = ledgerStore.append(LedgerEntry.builder()
                            .clinicId(purchase.getClinicId())
                            .amount(usage.get().getBonusCredits())
                            .kind(CreditTransactionKind.PROMO_BONUS)
                            .status(CreditTransactionStatus.COMPLETED)
                            .idempotencyKey(LedgerKeys.promoBonus(orderId))
                            .externalOrderId(orderId)
                            .refId(purchase.getRefId())
                            .description("Promo bonus")
                            .build());
                    bonusCredits = bonus.getAmount();
                    balanceAfter = bonus.getBalanceAfter();
                }

                metricsService.recordTopUpCredited(purchase.getClinicId(), completed.getAmount(), bonusCredits);
                return new TopUpConfirmation(purchase.getId(), purchase.getClinicId(), orderId, paymentId,
                        TopUpOutcome.CREDITED, completed.getAmount(), bonusCredits, balanceAfter, false);
            }
            default -> {
                metricsService.recordPaymentForFailedPurchase(purchase.getClinicId());
                log.error("Verified payment {} for order {} (clinic {}, {} credits) arrived after the purchase was {} ({}); "
                                + "not credited, needs manual review",
                        paymentId, orderId, purchase.getClinicId(), purchase.getAmount(), purchase.getStatus(),
                        purchase.getFailureReason());
                return new TopUpConfirmation(purchase.getId(), purchase.getClinicId(), orderId, paymentId,
                        TopUpOutcome.PAYMENT_NOT_VERIFIED, 0L, 0L, ledgerStore.getBalance(purchase.getClinicId()),
                        false);
            }
        }
    }

    private boolean failPurchase(CreditTransaction purchase, String reason) {
        boolean failed = ledgerStore.fail(purchase.getId(), reason).transitioned();
        if (failed) {
            promoEngine.release(purchase.getId());
        }
        return failed;
    }

    private BalanceDto toBalanceDto(ClinicAccount account) {
        return new BalanceDto(account.getClinicId(), account.getBalance(), isLow(account.getBalance()),
                account.isActive(), account.getUpdatedAt());
    }

    private boolean isLow(long balance) {
        return balance < billingProperties.getLowBalanceThreshold();
    }

    private String buildMetaJson(Map<String, Object> meta) {
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize ledger metadata {}: {}", meta, e.getMessage());
            return null;
        }
    }
}
