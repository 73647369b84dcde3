package uk.gegc.antidote.features.billing.domain.event;

/**
 * Raised after a deduction leaves a clinic below the low-balance threshold; consumed by notifications.
 */
public record LowBalanceEvent(Long clinicId, long balance, long threshold, Long leadId) {
}
