package uk.gegc.contentunlock.features.provider.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.contentunlock.features.provider.application.CircuitSnapshot;
import uk.gegc.contentunlock.features.provider.application.ProviderCircuitService;
import uk.gegc.contentunlock.features.provider.application.ProviderResilienceProperties;
import uk.gegc.contentunlock.features.provider.domain.exception.ProviderDegradedException;
import uk.gegc.contentunlock.features.provider.domain.model.CircuitState;
import uk.gegc.contentunlock.features.provider.domain.model.ProviderCircuitState;
import uk.gegc.contentunlock.features.provider.infra.repository.ProviderCircuitStateRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Database-backed breaker. Every transition is a compare-and-set on the row version, so
 * exactly one caller wins the OPEN to HALF_OPEN flip and becomes the recovery probe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderCircuitServiceImpl implements ProviderCircuitService {

    private static final int MAX_CAS_ATTEMPTS = 5;
    private static final int MAX_ERROR_LENGTH = 500;

    private final ProviderResilienceProperties properties;
    private final ProviderCircuitStateRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public void assertProviderAvailable(String providerKey) {
        if (!properties.getCircuit().isFailFast()) {
            return;
        }

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<ProviderCircuitState> row = repository.findById(providerKey);
            if (row.isEmpty() || row.get().getState() == CircuitState.CLOSED) {
                return;
            }

            ProviderCircuitState circuit = row.get();
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime blockedUntil = circuit.getCooldownUntil();
            if (blockedUntil != null && blockedUntil.isAfter(now)) {
                meterRegistry.counter("provider.circuit.rejected", "provider", providerKey).increment();
                throw new ProviderDegradedException(providerKey, secondsUntil(now, blockedUntil));
            }

            // Cooldown or the previous probe's lease has lapsed: try to become the probe
            LocalDateTime probeDeadline = now.plusSeconds(properties.getCircuit().getProbeLeaseSeconds());
            if (compareAndSet(circuit, CircuitState.HALF_OPEN, circuit.getFailureCount(),
                    circuit.getOpenedAt(), probeDeadline, circuit.getLastError(), now)) {
                log.info("Provider {} circuit half-open, probe allowed until {}", providerKey, probeDeadline);
                return;
            }
        }

        // Lost every race; somebody else holds the probe
        throw new ProviderDegradedException(providerKey, 1);
    }

    @Override
    public void recordProviderSuccess(String providerKey) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            ProviderCircuitState circuit = ensureRow(providerKey);
            if (circuit.getState() == CircuitState.CLOSED
                    && circuit.getFailureCount() == 0
                    && circuit.getLastError() == null) {
                return;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            if (compareAndSet(circuit, CircuitState.CLOSED, 0, null, null, null, now)) {
                if (circuit.getState() != CircuitState.CLOSED) {
                    log.info("Provider {} circuit closed after successful call", providerKey);
                }
                return;
            }
        }
        log.warn("Could not record success for provider {} after {} attempts", providerKey, MAX_CAS_ATTEMPTS);
    }

    @Override
    public void recordProviderFailure(String providerKey, String errorMessage) {
        String lastError = truncate(errorMessage);
        int threshold = properties.getCircuit().getFailureThreshold();

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            ProviderCircuitState circuit = ensureRow(providerKey);
            LocalDateTime now = LocalDateTime.now(clock);
            int failures = circuit.getFailureCount() + 1;
            boolean open = circuit.getState() == CircuitState.HALF_OPEN || failures >= threshold;

            CircuitState nextState = open ? CircuitState.OPEN : circuit.getState();
            LocalDateTime openedAt = open ? now : circuit.getOpenedAt();
            LocalDateTime cooldownUntil = open
                    ? now.plusSeconds(properties.getCircuit().getCooldownSeconds())
                    : circuit.getCooldownUntil();

            if (compareAndSet(circuit, nextState, failures, openedAt, cooldownUntil, lastError, now)) {
                if (open && circuit.getState() != CircuitState.OPEN) {
                    meterRegistry.counter("provider.circuit.opened", "provider", providerKey).increment();
                    log.warn("Provider {} circuit opened after {} failure(s) (was {}), cooling down until {}: {}",
                            providerKey, failures, circuit.getState(), cooldownUntil, lastError);
                }
                return;
            }
        }
        log.warn("Could not record failure for provider {} after {} attempts", providerKey, MAX_CAS_ATTEMPTS);
    }

    @Override
    public Optional<CircuitSnapshot> getSnapshot(String providerKey) {
        return repository.findById(providerKey).map(c -> new CircuitSnapshot(
                c.getProviderKey(),
                c.getState(),
                c.getFailureCount(),
                c.getOpenedAt(),
                c.getCooldownUntil(),
                c.getLastError()
        ));
    }

    @Override
    public boolean isFailFastEnabled() {
        return properties.getCircuit().isFailFast();
    }

    private boolean compareAndSet(ProviderCircuitState expected,
                                  CircuitState state,
                                  int failureCount,
                                  LocalDateTime openedAt,
                                  LocalDateTime cooldownUntil,
                                  String lastError,
                                  LocalDateTime now) {
        Integer updated = transactionTemplate.execute(status -> repository.compareAndSet(
                expected.getProviderKey(), state, failureCount, openedAt, cooldownUntil, lastError,
                now, expected.getVersion()));
        return updated != null && updated == 1;
    }

    private ProviderCircuitState ensureRow(String providerKey) {
        Optional<ProviderCircuitState> existing = repository.findById(providerKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        ProviderCircuitState circuit = new ProviderCircuitState();
        circuit.setProviderKey(providerKey);
        circuit.setState(CircuitState.CLOSED);
        circuit.setFailureCount(0);
        circuit.setVersion(0L);
        circuit.setCreatedAt(now);
        circuit.setUpdatedAt(now);
        try {
            ProviderCircuitState saved = transactionTemplate.execute(status -> repository.saveAndFlush(circuit));
            return saved != null ? saved : circuit;
        } catch (DataIntegrityViolationException ex) {
            return repository.findById(providerKey).orElseThrow(() -> ex);
        }
    }

    private static long secondsUntil(LocalDateTime now, LocalDateTime until) {
        long millis = Duration.between(now, until).toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
