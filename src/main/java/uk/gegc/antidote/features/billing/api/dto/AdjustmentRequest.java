package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "AdjustmentRequest")
public record AdjustmentRequest(
        @NotNull
        @Schema(description = "Signed, non-zero credit amount", example = "-500")
        Long amount,
        @NotBlank
        @Size(max = 500)
        String reason,
        @Size(max = 128)
        @Schema(description = "Optional client key; repeats with the same key are applied once")
        String idempotencyKey
) {
}
