package uk.gegc.antidote.features.billing.domain.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.antidote.features.billing.api.dto.DeductionResult;
import uk.gegc.antidote.features.billing.application.BillingService;

/**
 * Bills delivered leads once the delivering transaction has committed. The deduction runs in its own
 * transaction; failures are logged and never reach the lead system.
 */
@Slf4j
@Component
public class LeadDeliveredEventListener {

    private final BillingService billingService;
    private final TransactionTemplate deductionTransaction;

    public LeadDeliveredEventListener(BillingService billingService, PlatformTransactionManager transactionManager) {
        this.billingService = billingService;
        this.deductionTransaction = new TransactionTemplate(transactionManager);
        this.deductionTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleLeadDelivered(LeadDeliveredEvent event) {
        try {
            DeductionResult result = deductionTransaction.execute(status -> billingService.deductForLead(
                    event.clinicId(), event.leadId(), event.packageValue()));
            if (result != null && result.duplicate()) {
                log.debug("Lead {} for clinic {} was already billed", event.leadId(), event.clinicId());
            }
        } catch (Exception e) {
            log.error("Failed to bill lead {} for clinic {}: {}", event.leadId(), event.clinicId(), e.getMessage(), e);
        }
    }
}
