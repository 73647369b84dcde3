package uk.gegc.antidote.features.ledger.application;

import java.util.List;

/**
 * Verifies cached account balances against the ledger and repairs drift.
 */
public interface ReconciliationService {

    /**
     * Recomputes the clinic's balance from its completed entries and corrects the cached value if it drifted.
     */
    ReconciliationResult reconcile(Long clinicId);

    /**
     * Reconciles every account, each in its own transaction.
     */
    ReconciliationSummary reconcileAll();

    record ReconciliationResult(
            Long clinicId,
            boolean balanced,
            long calculatedBalance,
            long cachedBalance,
            long driftAmount,
            boolean corrected
    ) {
        public boolean hasDrift() {
            return driftAmount != 0;
        }
    }

    record ReconciliationSummary(
            int totalAccounts,
            int balancedAccounts,
            int accountsWithDrift,
            long totalDriftAmount,
            List<ReconciliationResult> driftResults
    ) {
        public boolean isSuccessful() {
            return accountsWithDrift == 0;
        }
    }
}
