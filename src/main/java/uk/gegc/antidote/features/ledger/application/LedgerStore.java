package uk.gegc.antidote.features.ledger.application;

import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only credit ledger with a cached balance per clinic account.
 *
 * <p>Write methods join the caller's transaction. A caller that needs "check then write" semantics
 * must call {@link #lockAccount(Long)} first so the check and the write happen under the same
 * account lock.
 */
public interface LedgerStore {

    /**
     * Creates the account if missing and reactivates it if it was deactivated.
     */
    ClinicAccount openAccount(Long clinicId);

    void deactivateAccount(Long clinicId);

    Optional<ClinicAccount> findAccount(Long clinicId);

    /**
     * Locks the account row for the rest of the current transaction, creating the account if needed.
     */
    ClinicAccount lockAccount(Long clinicId);

    /**
     * Appends a {@code PENDING} or {@code COMPLETED} entry. A completed entry moves the cached balance
     * in the same unit of work.
     *
     * @throws uk.gegc.antidote.features.ledger.domain.exception.DuplicateLedgerEntryException if the
     *         idempotency key is already used; nothing is written in that case
     */
    CreditTransaction append(LedgerEntry entry);

    /**
     * {@code PENDING -> COMPLETED}, crediting the balance.
     */
    TransitionResult complete(UUID transactionId, String paymentId);

    /**
     * {@code PENDING -> FAILED}. The balance is never touched.
     */
    TransitionResult fail(UUID transactionId, String reason);

    long getBalance(Long clinicId);

    Optional<CreditTransaction> findTransaction(UUID transactionId);

    Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey);

    /**
     * Locks an entry by idempotency key; used to serialize follow-up writes that reference it.
     */
    Optional<CreditTransaction> lockByIdempotencyKey(String idempotencyKey);

    Optional<CreditTransaction> lockTransaction(UUID transactionId);

    List<UUID> findPendingPurchasesCreatedBefore(LocalDateTime cutoff);

    /**
     * Most recent first. {@code pageToken} is the opaque cursor returned by the previous page.
     */
    LedgerPage listTransactions(Long clinicId, String pageToken, int size, CreditTransactionKind kind);
}
