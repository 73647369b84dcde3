package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "TopUpConfirmRequest", description = "Checkout callback from the payment processor")
public record TopUpConfirmRequest(
        @NotBlank String orderId,
        @NotBlank String paymentId,
        @NotBlank String signature
) {
}
