package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "BulkAdjustmentRequest")
public record BulkAdjustmentRequest(
        @NotEmpty
        @Size(max = 500)
        List<@Valid @NotNull Item> adjustments
) {

    @Schema(name = "BulkAdjustmentItem")
    public record Item(
            @NotNull
            Long clinicId,
            @NotNull
            @Schema(description = "Signed, non-zero credit amount", example = "1000")
            Long amount,
            @NotBlank
            @Size(max = 500)
            String reason,
            @Size(max = 128)
            String idempotencyKey
    ) {
    }
}
