package uk.gegc.antidote.features.pricing.application;

import java.math.BigDecimal;

/**
 * One validated price band. {@code upperExclusive} is null for the open-ended top band.
 */
public record PriceTier(BigDecimal lowerInclusive, BigDecimal upperExclusive, long credits) {

    public boolean contains(BigDecimal value) {
        return value.compareTo(lowerInclusive) >= 0
                && (upperExclusive == null || value.compareTo(upperExclusive) < 0);
    }
}
