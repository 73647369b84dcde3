package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a bulk adjustment. Each item is applied on its own; one failure never undoes the others.
 */
@Schema(name = "BulkAdjustmentResult")
public record BulkAdjustmentResult(
        int successful,
        int failed,
        List<ItemResult> results
) {

    /**
     * @param index     position of the item in the request
     * @param errorCode the error kind when the item failed, otherwise null
     */
    @Schema(name = "BulkAdjustmentItemResult")
    public record ItemResult(
            int index,
            Long clinicId,
            boolean success,
            UUID transactionId,
            String errorCode,
            String message
    ) {

        public static ItemResult applied(int index, Long clinicId, UUID transactionId) {
            return new ItemResult(index, clinicId, true, transactionId, null, null);
        }

        public static ItemResult rejected(int index, Long clinicId, String errorCode, String message) {
            return new ItemResult(index, clinicId, false, null, errorCode, message);
        }
    }
}
