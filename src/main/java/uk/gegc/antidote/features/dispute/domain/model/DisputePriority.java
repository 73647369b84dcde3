package uk.gegc.antidote.features.dispute.domain.model;

public enum DisputePriority {
    LOW,
    MEDIUM,
    HIGH
}
