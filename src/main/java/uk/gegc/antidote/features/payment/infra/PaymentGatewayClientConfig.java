package uk.gegc.antidote.features.payment.infra;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.antidote.features.payment.application.PaymentGatewayProperties;

@Configuration
public class PaymentGatewayClientConfig {

    @Bean
    public RestClient paymentGatewayRestClient(RestClient.Builder builder, PaymentGatewayProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        return builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> headers.setBasicAuth(
                        nullToEmpty(properties.getKeyId()), nullToEmpty(properties.getKeySecret())))
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
