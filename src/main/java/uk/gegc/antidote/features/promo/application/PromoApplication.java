package uk.gegc.antidote.features.promo.application;

import java.util.UUID;

/**
 * A validated promo code applied to a top-up amount.
 *
 * @param amount       credits purchased (before discount)
 * @param discount     currency units taken off the charge
 * @param chargeAmount what the clinic pays
 * @param bonusCredits extra credits granted once the purchase completes
 */
public record PromoApplication(
        UUID promoCodeId,
        String code,
        long amount,
        long discount,
        long chargeAmount,
        long bonusCredits
) {
}
