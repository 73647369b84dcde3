package uk.gegc.antidote.features.promo.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import uk.gegc.antidote.features.promo.domain.model.PromoDiscountType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Schema(name = "CreatePromoCodeRequest")
public record CreatePromoCodeRequest(
        @NotBlank
        @Size(max = 64)
        @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Code may only contain letters, digits, '-' and '_'")
        @Schema(example = "WELCOME20")
        String code,

        @Size(max = 255)
        String description,

        @NotNull
        PromoDiscountType discountType,

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        BigDecimal discountValue,

        @PositiveOrZero
        long bonusCredits,

        @PositiveOrZero
        long minAmount,

        @Positive
        Long maxDiscount,

        @Positive
        int usageLimit,

        @Schema(description = "Defaults to the configured per-clinic policy")
        Boolean singleUsePerClinic,

        LocalDateTime validFrom,

        LocalDateTime validUntil
) {
}
