package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "TransferRequest")
public record TransferRequest(
        @NotNull
        Long fromClinicId,
        @NotNull
        Long toClinicId,
        @NotNull
        @Positive
        @Schema(description = "Credits moved from the source to the destination clinic", example = "250")
        Long amount,
        @NotBlank
        @Size(max = 400)
        String reason,
        @Size(max = 128)
        @Schema(description = "Optional client key; repeats with the same key are applied once")
        String idempotencyKey
) {
}
