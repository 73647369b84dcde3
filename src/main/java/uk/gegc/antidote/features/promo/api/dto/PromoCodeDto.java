package uk.gegc.antidote.features.promo.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.antidote.features.promo.domain.model.PromoDiscountType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "PromoCode", description = "Promotional code for credit top-ups")
public record PromoCodeDto(
        UUID id,
        @Schema(example = "WELCOME20") String code,
        String description,
        PromoDiscountType discountType,
        @Schema(description = "Percent or currency units, depending on the discount type", example = "20")
        BigDecimal discountValue,
        long bonusCredits,
        long minAmount,
        Long maxDiscount,
        int usageLimit,
        int usedCount,
        boolean singleUsePerClinic,
        boolean active,
        LocalDateTime validFrom,
        LocalDateTime validUntil,
        LocalDateTime createdAt
) {
}
