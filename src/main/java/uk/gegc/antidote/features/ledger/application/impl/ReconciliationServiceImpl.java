package uk.gegc.antidote.features.ledger.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.antidote.features.ledger.application.ReconciliationService;
import uk.gegc.antidote.features.ledger.domain.model.ClinicAccount;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;
import uk.gegc.antidote.features.ledger.infra.repository.ClinicAccountRepository;
import uk.gegc.antidote.features.ledger.infra.repository.CreditTransactionRepository;
import uk.gegc.antidote.shared.metrics.BillingMetricsService;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    private final ClinicAccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final BillingMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;

    @Override
    @Transactional
    public ReconciliationResult reconcile(Long clinicId) {
        Optional<ClinicAccount> accountOpt = accountRepository.findByClinicIdForUpdate(clinicId);
        if (accountOpt.isEmpty()) {
            return new ReconciliationResult(clinicId, true, 0, 0, 0, false);
        }

        ClinicAccount account = accountOpt.get();
        long calculated = transactionRepository.sumAmountByClinicIdAndStatus(clinicId, CreditTransactionStatus.COMPLETED);
        long cached = account.getBalance();
        long drift = calculated - cached;

        if (drift == 0) {
            metricsService.recordReconciliationSuccess(clinicId);
            return new ReconciliationResult(clinicId, true, calculated, cached, 0, false);
        }

        log.warn("Balance drift for clinic {}: ledger={}, cached={}, drift={}; correcting cache",
                clinicId, calculated, cached, drift);
        metricsService.recordReconciliationDrift(clinicId, drift);
        account.setBalance(calculated);
        accountRepository.save(account);
        return new ReconciliationResult(clinicId, false, calculated, cached, drift, true);
    }

    @Override
    public ReconciliationSummary reconcileAll() {
        log.info("Starting reconciliation for all clinic accounts");

        List<Long> clinicIds = accountRepository.findAllClinicIds();
        List<ReconciliationResult> driftResults = new ArrayList<>();
        int failures = 0;

        for (Long clinicId : clinicIds) {
            try {
                ReconciliationResult result = transactionTemplate.execute(status -> reconcile(clinicId));
                if (result != null && result.hasDrift()) {
                    driftResults.add(result);
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Reconciliation failed for clinic {}: {}", clinicId, e.getMessage(), e);
            }
        }

        int total = clinicIds.size();
        long totalDrift = driftResults.stream()
                .mapToLong(ReconciliationResult::driftAmount)
                .sum();
        ReconciliationSummary summary = new ReconciliationSummary(
                total, total - driftResults.size() - failures, driftResults.size(), totalDrift, driftResults);

        log.info("Reconciliation completed: {} accounts, {} balanced, {} with drift, {} failed, total drift: {}",
                total, summary.balancedAccounts(), summary.accountsWithDrift(), failures, totalDrift);
        return summary;
    }

    /**
     * Weekly job, Sunday 02:00 by default.
     */
    @Scheduled(cron = "${billing.reconciliation-cron:0 0 2 * * SUN}")
    public void performWeeklyReconciliation() {
        try {
            ReconciliationSummary summary = reconcileAll();
            if (!summary.isSuccessful()) {
                log.warn("Weekly reconciliation corrected {} accounts, total drift: {} credits",
                        summary.accountsWithDrift(), summary.totalDriftAmount());
            }
        } catch (RuntimeException e) {
            log.error("Error during weekly reconciliation: {}", e.getMessage(), e);
        }
    }
}
