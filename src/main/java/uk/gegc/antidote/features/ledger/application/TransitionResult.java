package uk.gegc.antidote.features.ledger.application;

import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;

/**
 * Outcome of a status transition. {@code transitioned} is false when the entry had already left
 * {@code PENDING}; the entry is then returned untouched.
 */
public record TransitionResult(CreditTransaction transaction, boolean transitioned) {
}
