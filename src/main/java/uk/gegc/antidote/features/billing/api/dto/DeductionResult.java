package uk.gegc.antidote.features.billing.api.dto;

import java.util.UUID;

/**
 * @param duplicate true when the lead had already been billed; the original result is returned
 */
public record DeductionResult(
        UUID transactionId,
        Long clinicId,
        Long leadId,
        long creditsDeducted,
        long newBalance,
        boolean lowBalance,
        boolean duplicate
) {
}
