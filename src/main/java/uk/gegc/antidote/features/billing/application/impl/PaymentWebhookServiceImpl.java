package uk.gegc.antidote.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.api.dto.TopUpOutcome;
import uk.gegc.antidote.features.billing.application.InternalBillingService;
import uk.gegc.antidote.features.billing.application.PaymentWebhookService;
import uk.gegc.antidote.features.billing.application.WebhookLoggingContext;
import uk.gegc.antidote.features.payment.application.PaymentGateway;
import uk.gegc.antidote.features.payment.domain.exception.SignatureMismatchException;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.metrics.BillingMetricsService;

import java.util.Optional;

/**
 * Handles {@code payment.captured} and {@code payment.failed}; other events are acknowledged and ignored.
 * Redeliveries are absorbed by the purchase status transitions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookServiceImpl implements PaymentWebhookService {

    static final String PAYMENT_CAPTURED = "payment.captured";
    static final String PAYMENT_FAILED = "payment.failed";

    private final PaymentGateway paymentGateway;
    private final InternalBillingService internalBillingService;
    private final BillingMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    public Result process(String payload, String signature) {
        if (!paymentGateway.verifyWebhook(payload, signature)) {
            metricsService.recordSignatureMismatch("webhook");
            log.warn("Rejected payment webhook: signature mismatch");
            throw new SignatureMismatchException("Webhook signature could not be verified");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Webhook body is not valid JSON");
        }

        String eventType = root.path("event").asText(null);
        JsonNode payment = root.path("payload").path("payment").path("entity");
        String orderId = textOrNull(payment.path("order_id"));
        String paymentId = textOrNull(payment.path("id"));

        WebhookLoggingContext ctx = WebhookLoggingContext.builder()
                .eventType(eventType)
                .orderId(orderId)
                .paymentId(paymentId)
                .build();

        Result result;
        if (orderId == null || !(PAYMENT_CAPTURED.equals(eventType) || PAYMENT_FAILED.equals(eventType))) {
            ctx.logInfo(log, "Ignoring webhook event {}", eventType);
            result = Result.IGNORED;
        } else if (PAYMENT_CAPTURED.equals(eventType)) {
            result = handleCaptured(ctx, orderId, paymentId);
        } else {
            String reason = Optional.ofNullable(textOrNull(payment.path("error_description")))
                    .orElse("Payment failed at processor");
            boolean failed = internalBillingService.failPendingPurchase(orderId, reason);
            ctx.logInfo(log, "Processor reported failure for order {}: {} (applied={})", orderId, reason, failed);
            result = failed ? Result.OK : Result.DUPLICATE;
        }

        metricsService.recordWebhook(eventType, result.name());
        return result;
    }

    private Result handleCaptured(WebhookLoggingContext ctx, String orderId, String paymentId) {
        if (paymentId == null) {
            ctx.logWarn(log, "Captured event for order {} carries no payment id", orderId);
            return Result.IGNORED;
        }
        Optional<TopUpConfirmation> confirmation = internalBillingService.completeVerifiedPayment(orderId, paymentId);
        if (confirmation.isEmpty()) {
            ctx.logWarn(log, "No purchase found for captured order {}", orderId);
            return Result.IGNORED;
        }
        TopUpConfirmation c = confirmation.get();
        ctx.logInfo(log, "Captured payment for order {}: outcome={}, duplicate={}", orderId, c.outcome(), c.duplicate());
        if (c.outcome() == TopUpOutcome.PAYMENT_NOT_VERIFIED) {
            return Result.IGNORED;
        }
        return c.duplicate() ? Result.DUPLICATE : Result.OK;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank() ? null : node.asText();
    }
}
