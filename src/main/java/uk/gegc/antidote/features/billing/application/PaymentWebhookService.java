package uk.gegc.antidote.features.billing.application;

/**
 * Handles signed event notifications from the payment processor.
 */
public interface PaymentWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * @throws uk.gegc.antidote.features.payment.domain.exception.SignatureMismatchException if the body is not
     *         signed with the webhook secret
     */
    Result process(String payload, String signature);
}
