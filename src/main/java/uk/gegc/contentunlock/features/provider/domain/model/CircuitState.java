package uk.gegc.contentunlock.features.provider.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
