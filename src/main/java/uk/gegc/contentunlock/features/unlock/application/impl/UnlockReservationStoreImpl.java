package uk.gegc.contentunlock.features.unlock.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.contentunlock.features.unlock.application.ReserveOutcome;
import uk.gegc.contentunlock.features.unlock.application.UnlockProperties;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.domain.exception.UnlockNotFoundException;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;
import uk.gegc.contentunlock.features.unlock.domain.model.UnlockStatus;
import uk.gegc.contentunlock.features.unlock.infra.repository.UnlockRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import static uk.gegc.contentunlock.features.unlock.application.UnlockPricing.round3;

/**
 * Each write runs in its own short transaction and is conditioned on the row version (or on
 * status and owner), so concurrent callers re-read and re-decide instead of overwriting each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnlockReservationStoreImpl implements UnlockReservationStore {

    static final int MIN_RESERVATION_SECONDS = 30;
    static final int MAX_RESERVE_ROUNDS = 3;
    static final int MAX_EXPIRED_BATCH = 500;
    static final int MAX_ERROR_CODE_LENGTH = 120;
    static final int MAX_ERROR_MESSAGE_LENGTH = 500;
    static final String DEFAULT_FAILURE_CODE = "UNLOCK_GENERATION_FAILED";

    private final UnlockRepository unlockRepository;
    private final UnlockProperties unlockProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public Unlock ensureUnlock(String sourceItemId, String sourcePageId, BigDecimal estimatedCost) {
        String itemId = sourceItemId == null ? "" : sourceItemId.trim();
        if (itemId.isEmpty()) {
            throw new IllegalArgumentException("sourceItemId is required");
        }
        if (estimatedCost == null) {
            throw new IllegalArgumentException("estimatedCost is required");
        }
        BigDecimal cost = round3(estimatedCost);
        String pageId = sourcePageId == null || sourcePageId.isBlank() ? null : sourcePageId.trim();

        Optional<Unlock> existing = unlockRepository.findBySourceItemId(itemId);
        if (existing.isPresent()) {
            return refreshPricing(existing.get(), pageId, cost);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Unlock unlock = new Unlock();
        unlock.setSourceItemId(itemId);
        unlock.setSourcePageId(pageId);
        unlock.setStatus(UnlockStatus.AVAILABLE);
        unlock.setEstimatedCost(cost);
        unlock.setVersion(0L);
        unlock.setCreatedAt(now);
        unlock.setUpdatedAt(now);
        try {
            Unlock saved = transactionTemplate.execute(status -> unlockRepository.saveAndFlush(unlock));
            log.debug("Created unlock {} for source item {}", saved != null ? saved.getId() : null, itemId);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // Lost the insert race on source_item_id
            return unlockRepository.findBySourceItemId(itemId).orElseThrow(() -> ex);
        }
    }

    /**
     * Reprices an AVAILABLE row. The write is conditional on the version that was read, so a
     * reservation placed in between is never repriced; a miss re-reads and decides again.
     */
    private Unlock refreshPricing(Unlock snapshot, String pageId, BigDecimal cost) {
        Unlock current = snapshot;
        for (int round = 1; round <= MAX_RESERVE_ROUNDS; round++) {
            String nextPageId = pageId != null ? pageId : current.getSourcePageId();
            // A held reservation keeps the price it was held at
            BigDecimal nextCost = current.getStatus() == UnlockStatus.AVAILABLE ? cost : current.getEstimatedCost();

            boolean costChanged = current.getEstimatedCost() == null || current.getEstimatedCost().compareTo(nextCost) != 0;
            boolean pageChanged = !Objects.equals(nextPageId, current.getSourcePageId());
            if (!costChanged && !pageChanged) {
                return current;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            Unlock observed = current;
            int updated = write(() -> unlockRepository.updatePricing(
                    observed.getId(), observed.getVersion(), nextCost, nextPageId, now));
            current = reload(observed.getId());
            if (updated == 1) {
                return current;
            }
            log.debug("Unlock {} moved from version {} while repricing (round {})",
                    observed.getId(), observed.getVersion(), round);
        }
        return current;
    }

    @Override
    public ReserveOutcome reserve(Unlock unlock, UUID userId, BigDecimal estimatedCost, int reservationSeconds) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (unlock == null) {
            throw new IllegalArgumentException("unlock is required");
        }
        BigDecimal cost = round3(estimatedCost != null ? estimatedCost : unlock.getEstimatedCost());
        int holdSeconds = Math.max(MIN_RESERVATION_SECONDS, reservationSeconds);

        Unlock current = unlock;
        Unlock reclaimed = null;
        for (int round = 1; round <= MAX_RESERVE_ROUNDS; round++) {
            LocalDateTime now = LocalDateTime.now(clock);

            Optional<ReserveOutcome> settled = decideWithoutWrite(current, userId, now, reclaimed);
            if (settled.isPresent()) {
                return settled.get();
            }

            if (current.getStatus().isActive()) {
                // Expired reservation or processing window: release it before competing for it
                Unlock expired = current;
                if (write(() -> unlockRepository.releaseIfUnchanged(expired.getId(), expired.getVersion(), now)) == 1) {
                    log.info("Reclaimed expired {} unlock {} from user {}",
                            expired.getStatus(), expired.getId(), expired.getReservedByUserId());
                    reclaimed = expired;
                }
                current = reload(current.getId());
                continue;
            }

            if (current.getStatus() != UnlockStatus.AVAILABLE) {
                log.warn("Unlock {} is {} without a blueprint; treating as in progress", current.getId(), current.getStatus());
                return new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, current, false, reclaimed);
            }

            Unlock candidate = current;
            LocalDateTime expiresAt = now.plusSeconds(holdSeconds);
            boolean won = write(() -> unlockRepository.reserveIfAvailable(
                    candidate.getId(), candidate.getVersion(), userId, expiresAt, cost, now)) == 1;
            current = reload(current.getId());
            if (won) {
                return new ReserveOutcome(ReserveOutcome.State.RESERVED, current, true, reclaimed);
            }
            log.debug("Lost reserve race for unlock {} (round {})", current.getId(), round);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Unlock last = current;
        Unlock released = reclaimed;
        return decideWithoutWrite(last, userId, now, released)
                .orElseGet(() -> new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, last, false, released));
    }

    /**
     * Outcomes that need no write: already ready, or a live reservation/processing window.
     */
    private Optional<ReserveOutcome> decideWithoutWrite(Unlock unlock, UUID userId, LocalDateTime now, Unlock reclaimed) {
        if (unlock.getStatus() == UnlockStatus.READY && unlock.getBlueprintId() != null) {
            return Optional.of(new ReserveOutcome(ReserveOutcome.State.READY, unlock, false, reclaimed));
        }
        if (unlock.getStatus().isActive() && !unlock.isReservationExpired(now)) {
            if (unlock.getStatus() == UnlockStatus.RESERVED && userId.equals(unlock.getReservedByUserId())) {
                return Optional.of(new ReserveOutcome(ReserveOutcome.State.RESERVED, unlock, false, reclaimed));
            }
            return Optional.of(new ReserveOutcome(ReserveOutcome.State.IN_PROGRESS, unlock, false, reclaimed));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Unlock> attachReservationLedger(UUID unlockId, UUID userId, UUID ledgerId, BigDecimal amount) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = write(() -> unlockRepository.attachLedger(unlockId, userId, ledgerId, round3(amount), now));
        if (updated == 0) {
            log.warn("Could not attach ledger {} to unlock {}: no longer reserved by user {}", ledgerId, unlockId, userId);
            return Optional.empty();
        }
        return Optional.of(reload(unlockId));
    }

    @Override
    public Optional<Unlock> markProcessing(UUID unlockId, UUID userId, UUID jobId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime processingUntil = now.plusSeconds(unlockProperties.getProcessingWindowSeconds());
        int updated = write(() -> unlockRepository.markProcessing(unlockId, userId, jobId, processingUntil, now));
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(reload(unlockId));
    }

    @Override
    public Unlock completeUnlock(UUID unlockId, UUID blueprintId, UUID jobId) {
        if (blueprintId == null) {
            throw new IllegalArgumentException("blueprintId is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (write(() -> unlockRepository.complete(unlockId, blueprintId, jobId, now)) == 0) {
            throw new UnlockNotFoundException("Unlock " + unlockId + " not found");
        }
        return reload(unlockId);
    }

    @Override
    public Optional<Unlock> completeUnlockIfUnchanged(Unlock observed, UUID blueprintId, UUID jobId) {
        if (blueprintId == null) {
            throw new IllegalArgumentException("blueprintId is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = write(() -> unlockRepository.completeIfUnchanged(
                observed.getId(), observed.getVersion(), blueprintId, jobId, now));
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(reload(observed.getId()));
    }

    @Override
    public Unlock failUnlock(UUID unlockId, String errorCode, String errorMessage) {
        LocalDateTime now = LocalDateTime.now(clock);
        String code = normalizeErrorCode(errorCode);
        String message = truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH);
        if (write(() -> unlockRepository.fail(unlockId, code, message, now)) == 0) {
            throw new UnlockNotFoundException("Unlock " + unlockId + " not found");
        }
        return reload(unlockId);
    }

    @Override
    public Optional<Unlock> failUnlockIfUnchanged(Unlock observed, String errorCode, String errorMessage) {
        LocalDateTime now = LocalDateTime.now(clock);
        String code = normalizeErrorCode(errorCode);
        String message = truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH);
        int updated = write(() -> unlockRepository.failIfUnchanged(
                observed.getId(), observed.getVersion(), code, message, now));
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(reload(observed.getId()));
    }

    @Override
    public List<Unlock> findExpiredReserved(int limit) {
        int size = Math.max(1, Math.min(MAX_EXPIRED_BATCH, limit));
        return unlockRepository.findExpiredReserved(LocalDateTime.now(clock), PageRequest.of(0, size));
    }

    @Override
    public List<Unlock> listProcessing(int limit) {
        return unlockRepository.findByStatusOrderByUpdatedAtAsc(UnlockStatus.PROCESSING, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public Map<UUID, Long> countActiveLinksForJobs(Collection<UUID> jobIds) {
        Set<UUID> ids = new LinkedHashSet<>();
        if (jobIds != null) {
            jobIds.stream().filter(Objects::nonNull).forEach(ids::add);
        }
        if (ids.isEmpty()) {
            return Map.of();
        }
        Map<UUID, Long> counts = new HashMap<>();
        for (Object[] row : unlockRepository.countActiveByJobIds(ids)) {
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    public Optional<Unlock> findById(UUID unlockId) {
        return unlockRepository.findById(unlockId);
    }

    @Override
    public Optional<Unlock> findBySourceItemId(String sourceItemId) {
        if (sourceItemId == null || sourceItemId.isBlank()) {
            return Optional.empty();
        }
        return unlockRepository.findBySourceItemId(sourceItemId.trim());
    }

    @Override
    public List<Unlock> findBySourceItemIds(Collection<String> sourceItemIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (sourceItemIds != null) {
            sourceItemIds.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(id -> !id.isEmpty())
                    .forEach(ids::add);
        }
        if (ids.isEmpty()) {
            return List.of();
        }
        return unlockRepository.findBySourceItemIdIn(ids);
    }

    private int write(Supplier<Integer> update) {
        Integer updated = transactionTemplate.execute(status -> update.get());
        return updated == null ? 0 : updated;
    }

    private Unlock reload(UUID unlockId) {
        return unlockRepository.findById(unlockId)
                .orElseThrow(() -> new UnlockNotFoundException("Unlock " + unlockId + " not found"));
    }

    private static String normalizeErrorCode(String errorCode) {
        String code = truncate(errorCode, MAX_ERROR_CODE_LENGTH);
        return code == null || code.isBlank() ? DEFAULT_FAILURE_CODE : code;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
