package uk.gegc.antidote.features.ledger.domain.model;

/**
 * Lifecycle of a ledger entry. Only {@code PENDING -> COMPLETED} and {@code PENDING -> FAILED} are legal.
 * {@code REVERSED} is kept in the stored vocabulary but never assigned: a completed debit is offset by a
 * new {@link CreditTransactionKind#REFUND} entry instead.
 */
public enum CreditTransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REVERSED
}
