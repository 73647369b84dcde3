package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;
import java.util.UUID;

@Schema(name = "TopUpOrder", description = "A pending purchase and what the checkout widget needs to pay for it")
public record TopUpOrderDto(
        UUID transactionId,
        String orderId,
        long credits,
        long chargeAmount,
        long discount,
        long bonusCredits,
        String promoCode,
        String currency,
        String publicKey,
        Map<String, Object> checkoutParams
) {
}
