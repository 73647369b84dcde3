package uk.gegc.antidote.features.billing.domain.event;

import java.math.BigDecimal;

/**
 * Published by the lead system when a lead is handed to a clinic. Delivered at least once.
 */
public record LeadDeliveredEvent(Long clinicId, Long leadId, BigDecimal packageValue) {
}
