package uk.gegc.antidote.features.pricing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.antidote.features.pricing.application.PricingProperties;
import uk.gegc.antidote.features.pricing.application.PricingProperties.Band;
import uk.gegc.antidote.shared.exception.InvalidInputException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TieredPricingEngine")
class TieredPricingEngineTest {

    private TieredPricingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TieredPricingEngine(defaultTable());
    }

    @ParameterizedTest(name = "package value {0} costs {1} credits")
    @CsvSource({
            "1, 100",
            "4999, 100",
            "4999.99, 100",
            "5000, 180",
            "9999, 180",
            "10000, 250",
            "19999, 250",
            "20000, 320",
            "49999, 320",
            "50000, 400",
            "99999, 400",
            "100000, 500",
            "2500000, 500"
    })
    void priceFor_usesBandContainingValue(String packageValue, long expectedCredits) {
        assertThat(engine.priceFor(new BigDecimal(packageValue))).isEqualTo(expectedCredits);
    }

    @Test
    @DisplayName("priceFor: zero, negative and missing values are rejected")
    void priceFor_rejectsNonPositiveValues() {
        assertThatThrownBy(() -> engine.priceFor(BigDecimal.ZERO)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.priceFor(new BigDecimal("-1"))).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.priceFor(null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("tiers: exposes the table in order with the version")
    void tiers_exposeTable() {
        assertThat(engine.version()).isEqualTo("test-table");
        assertThat(engine.tiers()).hasSize(6);
        assertThat(engine.tiers().get(0).lowerInclusive()).isEqualByComparingTo("0");
        assertThat(engine.tiers().get(5).upperExclusive()).isNull();
    }

    @Nested
    @DisplayName("table validation")
    class TableValidation {

        @Test
        @DisplayName("a gap between bands is rejected")
        void gapRejected() {
            List<Band> bands = List.of(
                    band("0", "5000", 100),
                    band("6000", null, 180));
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(bands))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must start at 5000");
        }

        @Test
        @DisplayName("overlapping bands are rejected")
        void overlapRejected() {
            List<Band> bands = List.of(
                    band("0", "5000", 100),
                    band("4000", null, 180));
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(bands))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("the table must start at zero")
        void mustStartAtZero() {
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(List.of(band("1", null, 100))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("only the last band may be open-ended")
        void openEndedOnlyLast() {
            List<Band> bands = List.of(
                    band("0", null, 100),
                    band("5000", null, 180));
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(bands))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("open-ended");
        }

        @Test
        @DisplayName("a bounded last band is rejected")
        void boundedLastBandRejected() {
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(List.of(band("0", "5000", 100))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an empty table is rejected")
        void emptyRejected() {
            assertThatThrownBy(() -> TieredPricingEngine.buildTiers(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    static PricingProperties defaultTable() {
        PricingProperties properties = new PricingProperties();
        properties.setVersion("test-table");
        properties.setBands(List.of(
                band("0", "5000", 100),
                band("5000", "10000", 180),
                band("10000", "20000", 250),
                band("20000", "50000", 320),
                band("50000", "100000", 400),
                band("100000", null, 500)));
        return properties;
    }

    private static Band band(String lower, String upper, long credits) {
        return new Band(new BigDecimal(lower), upper != null ? new BigDecimal(upper) : null, credits);
    }
}
