package uk.gegc.contentunlock.features.unlock.domain.model;

public enum UnlockStatus {
    AVAILABLE,
    RESERVED,
    PROCESSING,
    READY;

    /**
     * Statuses in which a user holds the unlock and credits are on hold.
     */
    public boolean isActive() {
        return this == RESERVED || this == PROCESSING;
    }
}
