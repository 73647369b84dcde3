package uk.gegc.antidote.features.payment.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment processor connection settings.
 */
@Configuration
@ConfigurationProperties(prefix = "payment.gateway")
@Validated
@Data
public class PaymentGatewayProperties {

    /** Base URL of the processor's REST API. */
    @NotBlank
    private String baseUrl = "https://api.razorpay.com/v1";

    /** Public key id; also handed to the checkout widget. */
    private String keyId;

    /** Secret used for API basic auth and callback signatures. */
    private String keySecret;

    /** Secret used to sign webhook bodies. */
    private String webhookSecret;

    @NotBlank
    private String currency = "INR";

    /** Minor units per currency unit (paise per rupee). */
    private int minorUnitsPerUnit = 100;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(15);
}
