package uk.gegc.antidote.features.billing.application;

import uk.gegc.antidote.features.billing.api.dto.BalanceDto;
import uk.gegc.antidote.features.billing.api.dto.DeductionResult;
import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.api.dto.TopUpOrderDto;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.api.dto.TransactionPageDto;
import uk.gegc.antidote.features.billing.api.dto.TransferResult;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;

import java.math.BigDecimal;

/**
 * The only writer of the credit ledger. Every balance-affecting operation is all-or-nothing.
 */
public interface BillingService {

    /**
     * Idempotent; reactivates a deactivated account. Admin only.
     */
    BalanceDto openAccount(Long clinicId);

    /**
     * Stops new top-ups. Entries already in flight still settle. Admin only.
     */
    void deactivateAccount(Long clinicId);

    BalanceDto getBalance(Long clinicId);

    TransactionPageDto listTransactions(Long clinicId, String pageToken, int size, CreditTransactionKind kind);

    /**
     * Debits the lead's price. The balance may go negative; a retry for the same lead returns the
     * original result with {@code duplicate=true}.
     */
    DeductionResult deductForLead(Long clinicId, Long leadId, BigDecimal packageValue);

    /**
     * Creates a processor order and records the pending purchase.
     */
    TopUpOrderDto initiateTopUp(Long clinicId, long amount, String promoCode);

    /**
     * Settles a checkout callback. A bad signature fails the pending purchase and raises
     * {@link uk.gegc.antidote.features.payment.domain.exception.SignatureMismatchException}.
     */
    TopUpConfirmation confirmTopUp(String orderId, String paymentId, String signature);

    /**
     * Manual correction written as an {@code ADMIN_ADJUSTMENT}. Admin only.
     */
    TransactionDto adjustBalance(Long clinicId, long amount, String reason, String idempotencyKey);

    /**
     * Moves credits between two clinics as a pair of completed {@code ADMIN_ADJUSTMENT} entries written
     * together. The source balance must cover the amount. Admin only.
     */
    TransferResult transferCredits(Long fromClinicId, Long toClinicId, long amount, String reason,
                                   String idempotencyKey);

    /**
     * Fails pending purchases older than the configured TTL and releases their promo usages.
     *
     * @return number of purchases failed
     */
    int expireStalePurchases();
}
