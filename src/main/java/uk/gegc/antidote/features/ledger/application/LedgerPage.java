package uk.gegc.antidote.features.ledger.application;

import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;

import java.util.List;

public record LedgerPage(List<CreditTransaction> entries, String nextPageToken) {
}
