package uk.gegc.antidote.features.payment.application;

import java.util.Map;

/**
 * An order registered with the payment processor.
 *
 * @param chargeAmount   in whole currency units
 * @param checkoutParams parameters the client hands to the processor's checkout widget
 */
public record OrderHandle(
        String orderId,
        long chargeAmount,
        String currency,
        String publicKey,
        Map<String, Object> checkoutParams
) {
}
