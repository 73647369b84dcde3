package uk.gegc.antidote.features.promo.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.antidote.features.promo.api.dto.CreatePromoCodeRequest;
import uk.gegc.antidote.features.promo.api.dto.PromoCodeDto;
import uk.gegc.antidote.features.promo.application.PromoCodeService;
import uk.gegc.antidote.features.promo.application.PromoProperties;
import uk.gegc.antidote.features.promo.domain.model.PromoCode;
import uk.gegc.antidote.features.promo.domain.model.PromoDiscountType;
import uk.gegc.antidote.features.promo.infra.mapping.PromoCodeMapper;
import uk.gegc.antidote.features.promo.infra.repository.PromoCodeRepository;
import uk.gegc.antidote.shared.exception.DuplicateResourceException;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.exception.ResourceNotFoundException;
import uk.gegc.antidote.shared.security.AdminAccessPolicy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PromoCodeServiceImpl implements PromoCodeService {

    private static final BigDecimal MAX_PERCENT = BigDecimal.valueOf(100);

    private final PromoCodeRepository promoCodeRepository;
    private final PromoCodeMapper promoCodeMapper;
    private final PromoProperties promoProperties;
    private final AdminAccessPolicy adminAccessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public PromoCodeDto create(CreatePromoCodeRequest request) {
        adminAccessPolicy.requireAdmin("promo code creation");

        String code = PromoEngineImpl.normalize(request.code());
        if (code.isEmpty()) {
            throw new InvalidInputException("Promo code is required");
        }
        if (request.discountType() == PromoDiscountType.PERCENTAGE
                && request.discountValue().compareTo(MAX_PERCENT) > 0) {
            throw new InvalidInputException("Percentage discount cannot exceed 100");
        }
        if (request.validFrom() != null && request.validUntil() != null
                && !request.validUntil().isAfter(request.validFrom())) {
            throw new InvalidInputException("validUntil must be after validFrom");
        }
        if (promoCodeRepository.existsByCode(code)) {
            throw new DuplicateResourceException("Promo code " + code + " already exists");
        }

        PromoCode promo = new PromoCode();
        promo.setCode(code);
        promo.setDescription(request.description());
        promo.setDiscountType(request.discountType());
        promo.setDiscountValue(request.discountValue());
        promo.setBonusCredits(request.bonusCredits());
        promo.setMinAmount(request.minAmount());
        promo.setMaxDiscount(request.maxDiscount());
        promo.setUsageLimit(request.usageLimit());
        promo.setUsedCount(0);
        promo.setSingleUsePerClinic(request.singleUsePerClinic() != null
                ? request.singleUsePerClinic()
                : promoProperties.isSingleUsePerClinicDefault());
        promo.setActive(true);
        promo.setValidFrom(request.validFrom());
        promo.setValidUntil(request.validUntil());
        promo.setCreatedAt(LocalDateTime.now(clock));

        PromoCode saved = promoCodeRepository.save(promo);
        log.info("Created promo code {} by {}", saved.getCode(), adminAccessPolicy.currentActor());
        return promoCodeMapper.toDto(saved);
    }

    @Override
    @Transactional
    public PromoCodeDto deactivate(String code) {
        adminAccessPolicy.requireAdmin("promo code deactivation");

        String normalized = PromoEngineImpl.normalize(code);
        PromoCode promo = promoCodeRepository.findByCodeForUpdate(normalized)
                .orElseThrow(() -> new ResourceNotFoundException("Promo code " + normalized + " not found"));
        promo.setActive(false);
        log.info("Deactivated promo code {} by {}", normalized, adminAccessPolicy.currentActor());
        return promoCodeMapper.toDto(promoCodeRepository.save(promo));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PromoCodeDto> listActive() {
        adminAccessPolicy.requireAdmin("promo code listing");
        return promoCodeMapper.toDtos(promoCodeRepository.findByActiveTrueOrderByCodeAsc());
    }
}
