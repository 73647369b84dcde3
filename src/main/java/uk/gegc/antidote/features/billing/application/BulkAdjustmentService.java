package uk.gegc.antidote.features.billing.application;

import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentRequest;
import uk.gegc.antidote.features.billing.api.dto.BulkAdjustmentResult;

/**
 * Applies many balance adjustments in one call, each in its own transaction. Admin only.
 */
public interface BulkAdjustmentService {

    BulkAdjustmentResult applyAll(BulkAdjustmentRequest request);
}
