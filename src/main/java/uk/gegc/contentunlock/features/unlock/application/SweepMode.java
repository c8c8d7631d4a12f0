package uk.gegc.contentunlock.features.unlock.application;

public enum SweepMode {
    OPPORTUNISTIC,
    CRON,
    MANUAL
}
