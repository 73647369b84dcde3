package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "TopUpRequest")
public record TopUpRequest(
        @Positive
        @Schema(description = "Credits to buy; one credit costs one currency unit", example = "5000")
        long amount,
        @Size(max = 64)
        @Schema(example = "WELCOME20")
        String promoCode
) {
}
