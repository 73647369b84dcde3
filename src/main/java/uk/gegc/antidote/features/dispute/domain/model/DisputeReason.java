package uk.gegc.antidote.features.dispute.domain.model;

public enum DisputeReason {
    INVALID_CONTACT("Invalid contact information"),
    DUPLICATE_LEAD("Duplicate lead"),
    NOT_INTERESTED("Not interested in procedure"),
    FAKE_OR_SPAM("Fake/spam inquiry"),
    ALREADY_CONTACTED_ELSEWHERE("Already contacted elsewhere"),
    PRICE_INQUIRY_ONLY("Price inquiry only"),
    OUTSIDE_SERVICE_AREA("Outside service area"),
    MEDICAL_INELIGIBILITY("Medical ineligibility"),
    OTHER("Other");

    private final String label;

    DisputeReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
