package uk.gegc.antidote.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * MDC fields for processor webhook handling.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventType;
    private String orderId;
    private String paymentId;

    public void setMDC() {
        if (eventType != null) MDC.put("payment.webhook.eventType", eventType);
        if (orderId != null) MDC.put("payment.webhook.orderId", orderId);
        if (paymentId != null) MDC.put("payment.webhook.paymentId", paymentId);
    }

    public static void clearMDC() {
        MDC.remove("payment.webhook.eventType");
        MDC.remove("payment.webhook.orderId");
        MDC.remove("payment.webhook.paymentId");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }
}
