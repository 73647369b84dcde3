package uk.gegc.antidote.features.pricing.application;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps a lead's package value to its credit cost.
 */
public interface PricingEngine {

    /**
     * @throws uk.gegc.antidote.shared.exception.InvalidInputException if the value is null or not positive
     */
    long priceFor(BigDecimal packageValue);

    List<PriceTier> tiers();

    String version();
}
