package uk.gegc.antidote.features.payment.application.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.antidote.features.payment.application.OrderHandle;
import uk.gegc.antidote.features.payment.application.PaymentGateway;
import uk.gegc.antidote.features.payment.application.PaymentGatewayProperties;
import uk.gegc.antidote.features.payment.domain.exception.PaymentGatewayException;
import uk.gegc.antidote.features.payment.infra.HmacSignatures;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orders API client and signature checks for a Razorpay-compatible processor.
 * Callback signatures are HMAC-SHA256 of {@code orderId|paymentId} with the key secret; webhook
 * signatures are HMAC-SHA256 of the raw body with the webhook secret.
 */
@Slf4j
@Service
public class RazorpayPaymentGateway implements PaymentGateway {

    private final RestClient restClient;
    private final PaymentGatewayProperties properties;

    public RazorpayPaymentGateway(@Qualifier("paymentGatewayRestClient") RestClient restClient,
                                  PaymentGatewayProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public OrderHandle createOrder(Long clinicId, long chargeAmount, String reference) {
        if (chargeAmount <= 0) {
            throw new IllegalArgumentException("Charge amount must be positive");
        }
        long minorAmount = Math.multiplyExact(chargeAmount, (long) properties.getMinorUnitsPerUnit());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", minorAmount);
        body.put("currency", properties.getCurrency());
        body.put("receipt", reference);
        body.put("notes", Map.of("clinic_id", String.valueOf(clinicId), "reference", reference));

        ProcessorOrder order;
        try {
            order = restClient.post()
                    .uri("/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(ProcessorOrder.class);
        } catch (RestClientException e) {
            log.error("Order creation failed for clinic {} ({}): {}", clinicId, reference, e.getMessage());
            throw new PaymentGatewayException("Payment processor unavailable, please retry", e);
        }

        if (order == null || !StringUtils.hasText(order.id())) {
            throw new PaymentGatewayException("Payment processor returned no order id");
        }
        log.info("Created processor order {} for clinic {}: {} {}", order.id(), clinicId, chargeAmount,
                properties.getCurrency());

        Map<String, Object> checkout = new LinkedHashMap<>();
        checkout.put("key", properties.getKeyId());
        checkout.put("order_id", order.id());
        checkout.put("amount", minorAmount);
        checkout.put("currency", properties.getCurrency());
        return new OrderHandle(order.id(), chargeAmount, properties.getCurrency(), properties.getKeyId(), checkout);
    }

    @Override
    public boolean verifyCallback(String orderId, String paymentId, String signature) {
        if (!StringUtils.hasText(orderId) || !StringUtils.hasText(paymentId) || !StringUtils.hasText(signature)) {
            return false;
        }
        if (!StringUtils.hasText(properties.getKeySecret())) {
            log.error("payment.gateway.key-secret is not configured; rejecting callback for order {}", orderId);
            return false;
        }
        return HmacSignatures.matches(properties.getKeySecret(), orderId + "|" + paymentId, signature);
    }

    @Override
    public boolean verifyWebhook(String payload, String signature) {
        if (!StringUtils.hasText(payload) || !StringUtils.hasText(signature)) {
            return false;
        }
        if (!StringUtils.hasText(properties.getWebhookSecret())) {
            log.error("payment.gateway.webhook-secret is not configured; rejecting webhook");
            return false;
        }
        return HmacSignatures.matches(properties.getWebhookSecret(), payload, signature);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProcessorOrder(String id, Long amount, String currency, String status, String receipt) {
    }
}
