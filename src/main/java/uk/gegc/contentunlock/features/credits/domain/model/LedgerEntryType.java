package uk.gegc.contentunlock.features.credits.domain.model;

public enum LedgerEntryType {
    HOLD,
    SETTLE,
    REFUND
}
