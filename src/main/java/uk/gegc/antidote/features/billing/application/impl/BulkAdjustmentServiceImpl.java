package uk.gegc.antidote.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentRequest;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentResult;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentResult.ItemResult;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.billing.application.BillingService;
import uk.gegc.antidote.features.billing.application.BulkAdjustmentService;
import uk.gegc.antidote.shared.exception.BillingException;
import uk.gegc.antidote.shared.exception.InvalidInputException;
import uk.gegc.antidote.shared.security.AdminAccessPolicy;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class BulkAdjustmentServiceImpl implements BulkAdjustmentService {

    private final BillingService billingService;
    private final AdminAccessPolicy adminAccessPolicy;
    private final TransactionTemplate itemTransaction;

    public BulkAdjustmentServiceImpl(BillingService billingService,
                                     AdminAccessPolicy adminAccessPolicy,
                                     PlatformTransactionManager transactionManager) {
        this.billingService = billingService;
        this.adminAccessPolicy = adminAccessPolicy;
        this.itemTransaction = new TransactionTemplate(transactionManager);
        this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public BulkAdjustmentResult applyAll(BulkAdjustmentRequest request) {
        adminAccessPolicy.requireAdmin("bulk balance adjustment");
        if (request == null || request.adjustments() == null || request.adjustments().isEmpty()) {
            throw new InvalidInputException("At least one adjustment is required");
        }

        List<ItemResult> results = new ArrayList<>(request.adjustments().size());
        int successful = 0;
        int failed = 0;
        for (int i = 0; i < request.adjustments().size(); i++) {
            BulkAdjustmentRequest.Item item = request.adjustments().get(i);
            Long clinicId = item != null ? item.clinicId() : null;
            try {
                if (item == null || item.amount() == null) {
                    throw new InvalidInputException("Adjustment amount is required");
                }
                TransactionDto tx = itemTransaction.execute(status -> billingService.adjustBalance(
                        item.clinicId(), item.amount(), item.reason(), item.idempotencyKey()));
                results.add(ItemResult.applied(i, clinicId, tx != null ? tx.id() : null));
                successful++;
            } catch (BillingException e) {
                results.add(ItemResult.rejected(i, clinicId, e.getKind().name(), e.getMessage()));
                failed++;
            } catch (RuntimeException e) {
                log.error("Bulk adjustment item {} for clinic {} failed", i, clinicId, e);
                results.add(ItemResult.rejected(i, clinicId, e.getClass().getSimpleName(), e.getMessage()));
                failed++;
            }
        }
        log.info("Bulk adjustment by {}: {} applied, {} failed", adminAccessPolicy.currentActor(), successful, failed);
        return new BulkAdjustmentResult(successful, failed, results);
    }
}
