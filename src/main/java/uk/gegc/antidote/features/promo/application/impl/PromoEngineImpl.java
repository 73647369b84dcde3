package uk.gegc.antidote.features.promo.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.antidote.features.promo.application.PromoApplication;
import uk.gegc.antidote.features.promo.application.PromoEngine;
import uk.gegc.antidote.features.promo.domain.exception.PromoInvalidException;
import uk.gegc.antidote.features.promo.domain.exception.PromoRejectionReason;
import uk.gegc.antidote.features.promo.domain.model.PromoCode;
import uk.gegc.antidote.features.promo.domain.model.PromoDiscountType;
import uk.gegc.antidote.features.promo.domain.model.PromoUsage;
import uk.gegc.antidote.features.promo.domain.model.PromoUsageStatus;
import uk.gegc.antidote.features.promo.infra.repository.PromoCodeRepository;
import uk.gegc.antidote.features.promo.infra.repository.PromoUsageRepository;
import uk.gegc.antidote.shared.metrics.BillingMetricsService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PromoEngineImpl implements PromoEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Set<PromoUsageStatus> COUNTED_STATUSES =
            EnumSet.of(PromoUsageStatus.RESERVED, PromoUsageStatus.REDEEMED);

    private final PromoCodeRepository promoCodeRepository;
    private final PromoUsageRepository promoUsageRepository;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public PromoApplication validate(String code, Long clinicId, long amount) {
        String normalized = normalize(code);
        PromoCode promo = promoCodeRepository.findByCode(normalized)
                .orElseThrow(() -> reject(normalized, PromoRejectionReason.NOT_FOUND, "Promo code not found"));
        return evaluate(promo, clinicId, amount);
    }

    @Override
    @Transactional
    public PromoUsage reserve(PromoApplication application, Long clinicId, UUID transactionId) {
        PromoCode promo = promoCodeRepository.findByIdForUpdate(application.promoCodeId())
                .orElseThrow(() -> reject(application.code(), PromoRejectionReason.NOT_FOUND, "Promo code not found"));

        // state may have moved since validate(); the row lock makes this check authoritative
        PromoApplication current = evaluate(promo, clinicId, application.amount());

        promo.setUsedCount(promo.getUsedCount() + 1);
        promoCodeRepository.save(promo);

        PromoUsage usage = new PromoUsage();
        usage.setClinicId(clinicId);
        usage.setPromoCodeId(promo.getId());
        usage.setTransactionId(transactionId);
        usage.setDiscountApplied(current.discount());
        usage.setBonusCredits(current.bonusCredits());
        usage.setStatus(PromoUsageStatus.RESERVED);
        usage.setCreatedAt(LocalDateTime.now(clock));
        usage = promoUsageRepository.save(usage);

        log.info("Reserved promo {} for clinic {} (purchase {}, {}/{} used)",
                promo.getCode(), clinicId, transactionId, promo.getUsedCount(), promo.getUsageLimit());
        return usage;
    }

    @Override
    @Transactional
    public Optional<PromoUsage> redeem(UUID transactionId) {
        Optional<PromoUsage> usageOpt = promoUsageRepository.findByTransactionId(transactionId);
        if (usageOpt.isEmpty()) {
            return Optional.empty();
        }
        PromoUsage usage = usageOpt.get();
        if (usage.getStatus() == PromoUsageStatus.RESERVED) {
            usage.setStatus(PromoUsageStatus.REDEEMED);
            promoUsageRepository.save(usage);
            log.info("Redeemed promo usage {} for purchase {}", usage.getId(), transactionId);
        }
        return Optional.of(usage);
    }

    @Override
    @Transactional
    public Optional<PromoUsage> release(UUID transactionId) {
        Optional<PromoUsage> usageOpt = promoUsageRepository.findByTransactionId(transactionId);
        if (usageOpt.isEmpty() || usageOpt.get().getStatus() != PromoUsageStatus.RESERVED) {
            return Optional.empty();
        }
        PromoUsage usage = usageOpt.get();
        PromoCode promo = promoCodeRepository.findByIdForUpdate(usage.getPromoCodeId())
                .orElseThrow(() -> new IllegalStateException("Promo code " + usage.getPromoCodeId() + " vanished"));
        promo.setUsedCount(Math.max(0, promo.getUsedCount() - 1));
        promoCodeRepository.save(promo);

        usage.setStatus(PromoUsageStatus.RELEASED);
        promoUsageRepository.save(usage);
        log.info("Released promo {} usage for purchase {}", promo.getCode(), transactionId);
        return Optional.of(usage);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PromoUsage> findUsage(UUID transactionId) {
        return promoUsageRepository.findByTransactionId(transactionId);
    }

    private PromoApplication evaluate(PromoCode promo, Long clinicId, long amount) {
        String code = promo.getCode();
        LocalDateTime now = LocalDateTime.now(clock);

        if (!promo.isActive()) {
            throw reject(code, PromoRejectionReason.INACTIVE, "Promo code is no longer active");
        }
        if (promo.getValidFrom() != null && now.isBefore(promo.getValidFrom())) {
            throw reject(code, PromoRejectionReason.NOT_YET_VALID, "Promo code is not valid yet");
        }
        if (promo.getValidUntil() != null && now.isAfter(promo.getValidUntil())) {
            throw reject(code, PromoRejectionReason.EXPIRED, "Promo code has expired");
        }
        if (amount < promo.getMinAmount()) {
            throw reject(code, PromoRejectionReason.BELOW_MINIMUM,
                    "Minimum purchase for this code is " + promo.getMinAmount());
        }
        if (promo.getUsedCount() >= promo.getUsageLimit()) {
            throw reject(code, PromoRejectionReason.EXHAUSTED, "Promo code usage limit reached");
        }
        if (promo.isSingleUsePerClinic()) {
            long prior = promoUsageRepository.countByClinicIdAndPromoCodeIdAndStatusIn(
                    clinicId, promo.getId(), COUNTED_STATUSES);
            if (prior > 0) {
                throw reject(code, PromoRejectionReason.ALREADY_REDEEMED, "Promo code already used by this clinic");
            }
        }

        long discount = discountFor(promo, amount);
        if (discount >= amount) {
            throw reject(code, PromoRejectionReason.DISCOUNT_EXCEEDS_AMOUNT,
                    "Discount would leave nothing to charge");
        }
        return new PromoApplication(promo.getId(), code, amount, discount, amount - discount, promo.getBonusCredits());
    }

    static long discountFor(PromoCode promo, long amount) {
        if (promo.getDiscountType() == PromoDiscountType.PERCENTAGE) {
            long discount = BigDecimal.valueOf(amount)
                    .multiply(promo.getDiscountValue())
                    .divide(HUNDRED, 0, RoundingMode.FLOOR)
                    .longValueExact();
            return promo.getMaxDiscount() != null ? Math.min(discount, promo.getMaxDiscount()) : discount;
        }
        return promo.getDiscountValue().setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    private PromoInvalidException reject(String code, PromoRejectionReason reason, String message) {
        metricsService.recordPromoRejected(reason.name());
        log.info("Promo code {} rejected: {}", code, reason);
        return new PromoInvalidException(code, reason, message);
    }

    static String normalize(String code) {
        return StringUtils.hasText(code) ? code.trim().toUpperCase(Locale.ROOT) : "";
    }
}
