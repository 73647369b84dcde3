package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "Balance", description = "Cached credit balance of a clinic")
public record BalanceDto(
        Long clinicId,
        @Schema(description = "Credits; may be negative", example = "1250")
        long balance,
        @Schema(description = "True when the balance is below the low-balance threshold")
        boolean lowBalance,
        boolean active,
        LocalDateTime updatedAt
) {
}
