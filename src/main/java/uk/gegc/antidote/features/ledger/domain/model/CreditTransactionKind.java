package uk.gegc.antidote.features.ledger.domain.model;

public enum CreditTransactionKind {
    PURCHASE,
    LEAD_DEDUCTION,
    REFUND,
    PROMO_BONUS,
    ADMIN_ADJUSTMENT
}
