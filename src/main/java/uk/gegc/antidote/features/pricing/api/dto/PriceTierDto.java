package uk.gegc.antidote.features.pricing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "PriceTier", description = "A package value band and the credits a lead in it costs")
public record PriceTierDto(
        @Schema(description = "Inclusive lower bound of the package value", example = "5000")
        BigDecimal lowerInclusive,
        @Schema(description = "Exclusive upper bound; absent for the top band", example = "10000")
        BigDecimal upperExclusive,
        @Schema(description = "Credits charged per lead", example = "180")
        long credits
) {
}
