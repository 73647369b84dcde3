package uk.gegc.antidote.features.pricing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned lead-price table: package value bands and the credit cost of each band.
 */
@Configuration
@ConfigurationProperties(prefix = "billing.pricing")
@Validated
@Data
public class PricingProperties {

    /**
     * Identifier of the active table, reported alongside the tiers.
     */
    @NotBlank
    private String version = "default";

    /**
     * Ordered bands; lower bound inclusive, upper bound exclusive, last band open-ended.
     */
    @NotEmpty
    @Valid
    private List<Band> bands = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        @NotNull
        @PositiveOrZero
        private BigDecimal lowerBound;

        private BigDecimal upperBound;

        @Positive
        private long credits;
    }
}
