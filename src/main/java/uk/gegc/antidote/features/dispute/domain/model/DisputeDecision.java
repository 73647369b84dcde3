package uk.gegc.antidote.features.dispute.domain.model;

public enum DisputeDecision {
    APPROVED,
    REJECTED;

    public DisputeStatus toStatus() {
        return this == APPROVED ? DisputeStatus.APPROVED : DisputeStatus.REJECTED;
    }
}
