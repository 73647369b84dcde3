package uk.gegc.antidote.features.dispute.domain.model;

public enum DisputeStatus {
    PENDING,
    APPROVED,
    REJECTED
}
