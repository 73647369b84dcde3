package uk.gegc.antidote.features.pricing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.antidote.features.pricing.application.PriceTier;
import uk.gegc.antidote.features.pricing.application.PricingEngine;
import uk.gegc.antidote.features.pricing.application.PricingProperties;
import uk.gegc.antidote.shared.exception.InvalidInputException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Band lookup over the configured table. The table is checked once at construction: it must start at
 * zero, be contiguous and non-overlapping, and only its last band may be open-ended.
 */
@Slf4j
@Service
public class TieredPricingEngine implements PricingEngine {

    private final List<PriceTier> tiers;
    private final String version;

    public TieredPricingEngine(PricingProperties properties) {
        this.tiers = List.copyOf(buildTiers(properties.getBands()));
        this.version = properties.getVersion();
        log.info("Loaded lead price table {} with {} bands", version, tiers.size());
    }

    @Override
    public long priceFor(BigDecimal packageValue) {
        if (packageValue == null || packageValue.signum() <= 0) {
            throw new InvalidInputException("Package value must be positive, got " + packageValue);
        }
        for (PriceTier tier : tiers) {
            if (tier.contains(packageValue)) {
                return tier.credits();
            }
        }
        // unreachable with a validated table
        throw new IllegalStateException("No price band covers " + packageValue);
    }

    @Override
    public List<PriceTier> tiers() {
        return tiers;
    }

    @Override
    public String version() {
        return version;
    }

    static List<PriceTier> buildTiers(List<PricingProperties.Band> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("Price table must define at least one band");
        }
        List<PriceTier> result = new ArrayList<>(bands.size());
        BigDecimal expectedLower = BigDecimal.ZERO;
        for (int i = 0; i < bands.size(); i++) {
            PricingProperties.Band band = bands.get(i);
            boolean last = i == bands.size() - 1;
            if (band.getLowerBound() == null || band.getLowerBound().compareTo(expectedLower) != 0) {
                throw new IllegalArgumentException("Band " + i + " must start at " + expectedLower
                        + " but starts at " + band.getLowerBound());
            }
            if (band.getCredits() <= 0) {
                throw new IllegalArgumentException("Band " + i + " must cost a positive number of credits");
            }
            if (band.getUpperBound() == null && !last) {
                throw new IllegalArgumentException("Only the last band may be open-ended (band " + i + ")");
            }
            if (band.getUpperBound() != null && band.getUpperBound().compareTo(band.getLowerBound()) <= 0) {
                throw new IllegalArgumentException("Band " + i + " upper bound must exceed its lower bound");
            }
            if (last && band.getUpperBound() != null) {
                throw new IllegalArgumentException("The last band must be open-ended");
            }
            result.add(new PriceTier(band.getLowerBound(), band.getUpperBound(), band.getCredits()));
            expectedLower = band.getUpperBound();
        }
        return result;
    }
}
