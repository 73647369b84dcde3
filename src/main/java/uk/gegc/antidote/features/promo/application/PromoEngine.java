package uk.gegc.antidote.features.promo.application;

import uk.gegc.antidote.features.promo.domain.model.PromoUsage;

import java.util.Optional;
import java.util.UUID;

/**
 * Promo code evaluation and the usage lifecycle that follows a purchase.
 */
public interface PromoEngine {

    /**
     * Read-only check of a code against a top-up amount.
     *
     * @throws uk.gegc.antidote.features.promo.domain.exception.PromoInvalidException with the first failing reason
     */
    PromoApplication validate(String code, Long clinicId, long amount);

    /**
     * Locks the code, re-validates it and records a {@code RESERVED} usage for the purchase.
     * Must run in the transaction that writes the pending purchase.
     */
    PromoUsage reserve(PromoApplication application, Long clinicId, UUID transactionId);

    /**
     * Marks the purchase's usage {@code REDEEMED}. Empty when the purchase used no code.
     */
    Optional<PromoUsage> redeem(UUID transactionId);

    /**
     * Marks the purchase's usage {@code RELEASED} and gives the slot back. Empty when there was nothing to release.
     */
    Optional<PromoUsage> release(UUID transactionId);

    Optional<PromoUsage> findUsage(UUID transactionId);
}
