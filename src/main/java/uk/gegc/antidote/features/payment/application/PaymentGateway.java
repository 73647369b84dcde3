package uk.gegc.antidote.features.payment.application;

/**
 * Adapter over the external payment processor. Never touches the ledger.
 */
public interface PaymentGateway {

    /**
     * Registers an order for {@code chargeAmount} currency units.
     *
     * @throws uk.gegc.antidote.features.payment.domain.exception.PaymentGatewayException if the processor
     *         cannot be reached or rejects the request; safe to retry
     */
    OrderHandle createOrder(Long clinicId, long chargeAmount, String reference);

    /**
     * Checks the checkout callback signature. Missing values never verify.
     */
    boolean verifyCallback(String orderId, String paymentId, String signature);

    /**
     * Checks the signature of a raw webhook body.
     */
    boolean verifyWebhook(String payload, String signature);
}
