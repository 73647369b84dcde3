package uk.gegc.antidote.features.pricing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "PriceTable", description = "The active lead price table")
public record PriceTableDto(
        @Schema(description = "Configured table version", example = "2024-01")
        String version,
        List<PriceTierDto> tiers
) {
}
