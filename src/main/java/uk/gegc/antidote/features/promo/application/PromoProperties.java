package uk.gegc.antidote.features.promo.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "billing.promo")
@Validated
@Data
public class PromoProperties {

    /**
     * Per-clinic policy applied to new codes that do not set one explicitly.
     */
    private boolean singleUsePerClinicDefault = true;
}
