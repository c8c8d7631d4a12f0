package uk.gegc.contentunlock.features.credits.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.contentunlock.features.credits.api.dto.LedgerEntryDto;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.application.CreditMetricsService;
import uk.gegc.contentunlock.features.credits.application.CreditStructuredLogger;
import uk.gegc.contentunlock.features.credits.application.CreditWalletProperties;
import uk.gegc.contentunlock.features.credits.application.HoldResult;
import uk.gegc.contentunlock.features.credits.application.LedgerContext;
import uk.gegc.contentunlock.features.credits.application.LedgerRequest;
import uk.gegc.contentunlock.features.credits.application.LedgerWriteResult;
import uk.gegc.contentunlock.features.credits.application.WalletSnapshot;
import uk.gegc.contentunlock.features.credits.domain.exception.IdempotencyConflictException;
import uk.gegc.contentunlock.features.credits.domain.exception.SettleExceedsHoldException;
import uk.gegc.contentunlock.features.credits.domain.exception.WalletConflictException;
import uk.gegc.contentunlock.features.credits.domain.model.CreditWallet;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntry;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;
import uk.gegc.contentunlock.features.credits.infra.mapping.LedgerEntryMapper;
import uk.gegc.contentunlock.features.credits.infra.repository.CreditWalletRepository;
import uk.gegc.contentunlock.features.credits.infra.repository.LedgerEntryRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.contentunlock.features.credits.application.impl.WalletRefill.round3;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private final CreditWalletProperties walletProperties;
    private final CreditWalletRepository walletRepository;
    private final LedgerEntryRepository ledgerRepository;
    private final LedgerEntryMapper ledgerEntryMapper;
    private final CreditMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public HoldResult reserveCredits(LedgerRequest request) {
        BigDecimal amount = validate(request);

        if (walletProperties.isBypass()) {
            return HoldResult.bypassed(amount, getWallet(request.userId()));
        }

        Optional<LedgerEntry> existing = findExisting(request.idempotencyKey(), LedgerEntryType.HOLD);
        if (existing.isPresent()) {
            return replayedHold(existing.get());
        }

        ensureWallet(request.userId());
        int maxAttempts = walletProperties.getMaxCasAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            WalletMutation mutation;
            try {
                mutation = transactionTemplate.execute(status -> debitOnce(request, amount));
            } catch (DataIntegrityViolationException ex) {
                // A concurrent request with the same key won the insert
                return findExisting(request.idempotencyKey(), LedgerEntryType.HOLD)
                        .map(this::replayedHold)
                        .orElseThrow(() -> ex);
            }

            if (mutation == null || mutation.conflict()) {
                metricsService.incrementWalletCasConflict();
                backoff(attempt);
                continue;
            }
            if (mutation.insufficient()) {
                metricsService.incrementInsufficientCredits();
                log.info("Insufficient credits for user {}: required={}, balance={}",
                        request.userId(), amount, mutation.snapshot().balance());
                return HoldResult.insufficient(amount, mutation.snapshot());
            }

            LedgerEntry entry = mutation.entry();
            metricsService.incrementHoldPlaced(amount);
            CreditStructuredLogger.logLedgerWrite(log, "info", "Ledger HOLD written",
                    request.userId(), LedgerEntryType.HOLD.name(), entry.getAmount(),
                    request.idempotencyKey(), entry.getBalanceAfter(), request.reasonCode(),
                    request.context().traceId());
            return HoldResult.held(entry.getId(), amount, mutation.snapshot(), false);
        }

        log.warn("reserveCredits() wallet compare-and-set failed after {} attempts for user {}", maxAttempts, request.userId());
        throw new WalletConflictException(request.userId(), maxAttempts);
    }

    @Override
    public LedgerWriteResult settleReservation(LedgerRequest request, BigDecimal heldAmount) {
        BigDecimal amount = validate(request);
        BigDecimal held = heldAmount == null ? amount : round3(heldAmount);
        if (amount.compareTo(held) > 0) {
            throw new SettleExceedsHoldException(amount, held);
        }

        if (walletProperties.isBypass()) {
            return LedgerWriteResult.bypassed();
        }

        BigDecimal released = held.subtract(amount);
        LedgerWriteResult result = credit(request, LedgerEntryType.SETTLE, released, amount);
        if (result.applied()) {
            metricsService.incrementSettled(amount, released);
        }
        return result;
    }

    @Override
    public LedgerWriteResult refundReservation(LedgerRequest request) {
        BigDecimal amount = validate(request);

        if (walletProperties.isBypass()) {
            return LedgerWriteResult.bypassed();
        }

        LedgerWriteResult result = credit(request, LedgerEntryType.REFUND, amount, null);
        if (result.applied()) {
            metricsService.incrementRefunded(amount);
        }
        return result;
    }

    @Override
    public WalletSnapshot getWallet(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        CreditWallet wallet = ensureWallet(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal refilled = WalletRefill.refilledBalance(wallet, now);

        if (refilled.compareTo(wallet.getBalance()) != 0) {
            // Persisting the refill is best effort; a lost race just means someone else wrote first
            Integer updated = transactionTemplate.execute(status -> walletRepository.compareAndSetBalance(
                    userId, refilled, now, now, wallet.getVersion()));
            if (updated != null && updated == 1) {
                return snapshot(wallet, refilled, now);
            }
            CreditWallet latest = walletRepository.findById(userId).orElse(wallet);
            return snapshot(latest, WalletRefill.refilledBalance(latest, now), latest.getLastRefillAt());
        }
        return snapshot(wallet, refilled, wallet.getLastRefillAt());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntryDto> findEntry(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        return ledgerRepository.findByIdempotencyKey(idempotencyKey).map(ledgerEntryMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BigDecimal> findHeldAmount(UUID holdLedgerId) {
        if (holdLedgerId == null) {
            return Optional.empty();
        }
        return ledgerRepository.findById(holdLedgerId)
                .filter(entry -> entry.getEntryType() == LedgerEntryType.HOLD)
                .map(LedgerEntry::getAmount);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<LedgerEntryDto> listEntries(UUID userId,
                                            LedgerEntryType type,
                                            LocalDateTime dateFrom,
                                            LocalDateTime dateTo,
                                            Pageable pageable) {
        return ledgerRepository
                .findByFilters(userId, type, dateFrom, dateTo, pageable)
                .map(ledgerEntryMapper::toDto);
    }

    private LedgerWriteResult credit(LedgerRequest request,
                                     LedgerEntryType type,
                                     BigDecimal creditAmount,
                                     BigDecimal settledAmount) {
        Optional<LedgerEntry> existing = findExisting(request.idempotencyKey(), type);
        if (existing.isPresent()) {
            return replayedWrite(existing.get());
        }

        ensureWallet(request.userId());
        int maxAttempts = walletProperties.getMaxCasAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            WalletMutation mutation;
            try {
                mutation = transactionTemplate.execute(status -> creditOnce(request, type, creditAmount, settledAmount));
            } catch (DataIntegrityViolationException ex) {
                return findExisting(request.idempotencyKey(), type)
                        .map(this::replayedWrite)
                        .orElseThrow(() -> ex);
            }

            if (mutation == null || mutation.conflict()) {
                metricsService.incrementWalletCasConflict();
                backoff(attempt);
                continue;
            }

            LedgerEntry entry = mutation.entry();
            CreditStructuredLogger.logLedgerWrite(log, "info", "Ledger {} written",
                    request.userId(), type.name(), entry.getAmount(), request.idempotencyKey(),
                    entry.getBalanceAfter(), request.reasonCode(), request.context().traceId(), type);
            return new LedgerWriteResult(entry.getId(), true, false, entry.getBalanceAfter());
        }

        log.warn("{} wallet compare-and-set failed after {} attempts for user {}", type, maxAttempts, request.userId());
        throw new WalletConflictException(request.userId(), maxAttempts);
    }

    private WalletMutation debitOnce(LedgerRequest request, BigDecimal amount) {
        CreditWallet wallet = walletRepository.findById(request.userId())
                .orElseThrow(() -> new IllegalStateException("Wallet missing for user " + request.userId()));
        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal available = WalletRefill.refilledBalance(wallet, now);

        if (available.compareTo(amount) < 0) {
            return WalletMutation.insufficient(snapshot(wallet, available, now));
        }

        BigDecimal next = round3(available.subtract(amount));
        if (walletRepository.compareAndSetBalance(request.userId(), next, now, now, wallet.getVersion()) == 0) {
            return WalletMutation.lostRace();
        }

        LedgerEntry entry = newEntry(request, LedgerEntryType.HOLD, amount.negate(), null, next, now, null);
        entry = ledgerRepository.saveAndFlush(entry);
        return WalletMutation.applied(entry, snapshot(wallet, next, now));
    }

    private WalletMutation creditOnce(LedgerRequest request,
                                      LedgerEntryType type,
                                      BigDecimal creditAmount,
                                      BigDecimal settledAmount) {
        CreditWallet wallet = walletRepository.findById(request.userId())
                .orElseThrow(() -> new IllegalStateException("Wallet missing for user " + request.userId()));
        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal current = WalletRefill.refilledBalance(wallet, now);
        BigDecimal next = WalletRefill.clamp(current.add(creditAmount), wallet.getCapacity());

        if (creditAmount.signum() > 0
                && walletRepository.compareAndSetBalance(request.userId(), next, now, now, wallet.getVersion()) == 0) {
            return WalletMutation.lostRace();
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        if (type == LedgerEntryType.SETTLE) {
            extra.put("settled_amount", settledAmount);
            extra.put("released", creditAmount);
        }
        LedgerEntry entry = newEntry(request, type, creditAmount, settledAmount, next, now, extra);
        entry = ledgerRepository.saveAndFlush(entry);
        return WalletMutation.applied(entry, snapshot(wallet, next, now));
    }

    private LedgerEntry newEntry(LedgerRequest request,
                                 LedgerEntryType type,
                                 BigDecimal amount,
                                 BigDecimal settledAmount,
                                 BigDecimal balanceAfter,
                                 LocalDateTime now,
                                 Map<String, Object> extra) {
        LedgerContext context = request.context();
        LedgerEntry entry = new LedgerEntry();
        entry.setIdempotencyKey(request.idempotencyKey());
        entry.setEntryType(type);
        entry.setUserId(request.userId());
        entry.setAmount(round3(amount));
        entry.setSettledAmount(settledAmount);
        entry.setBalanceAfter(balanceAfter);
        entry.setReasonCode(request.reasonCode());
        entry.setUnlockId(context.unlockId());
        entry.setSourceItemId(context.sourceItemId());
        entry.setSourcePageId(context.sourcePageId());
        entry.setContextJson(buildContextJson(context, extra));
        entry.setCreatedAt(now);
        return entry;
    }

    /**
     * Returns the wallet row, creating it with the configured defaults on first use.
     */
    private CreditWallet ensureWallet(UUID userId) {
        Optional<CreditWallet> existing = walletRepository.findById(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        CreditWallet wallet = new CreditWallet();
        wallet.setUserId(userId);
        wallet.setBalance(walletProperties.effectiveInitialBalance());
        wallet.setCapacity(round3(walletProperties.getCapacity()));
        wallet.setRefillRatePerSec(walletProperties.refillRatePerSec());
        wallet.setLastRefillAt(now);
        wallet.setVersion(0L);
        wallet.setCreatedAt(now);
        wallet.setUpdatedAt(now);
        try {
            CreditWallet saved = transactionTemplate.execute(status -> walletRepository.saveAndFlush(wallet));
            log.info("Created wallet for user {} with balance {}", userId, wallet.getBalance());
            return saved != null ? saved : wallet;
        } catch (DataIntegrityViolationException ex) {
            return walletRepository.findById(userId).orElseThrow(() -> ex);
        }
    }

    private Optional<LedgerEntry> findExisting(String idempotencyKey, LedgerEntryType expectedType) {
        Optional<LedgerEntry> existing = ledgerRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent() && existing.get().getEntryType() != expectedType) {
            throw new IdempotencyConflictException("Idempotency key " + idempotencyKey
                    + " already used for " + existing.get().getEntryType() + ", not " + expectedType);
        }
        return existing;
    }

    private HoldResult replayedHold(LedgerEntry entry) {
        metricsService.incrementHoldReplayed();
        log.debug("Hold {} replayed for key {}", entry.getId(), entry.getIdempotencyKey());
        return HoldResult.held(entry.getId(), entry.getAmount().negate(), getWallet(entry.getUserId()), true);
    }

    private LedgerWriteResult replayedWrite(LedgerEntry entry) {
        log.debug("{} {} replayed for key {}", entry.getEntryType(), entry.getId(), entry.getIdempotencyKey());
        return new LedgerWriteResult(entry.getId(), false, false, entry.getBalanceAfter());
    }

    private WalletSnapshot snapshot(CreditWallet wallet, BigDecimal balance, LocalDateTime lastRefillAt) {
        return new WalletSnapshot(
                wallet.getUserId(),
                balance,
                wallet.getCapacity(),
                wallet.getRefillRatePerSec(),
                lastRefillAt,
                WalletRefill.secondsToFull(balance, wallet.getCapacity(), wallet.getRefillRatePerSec()),
                walletProperties.isBypass()
        );
    }

    private BigDecimal validate(LedgerRequest request) {
        if (request == null || request.userId() == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (request.idempotencyKey() == null || request.idempotencyKey().isBlank()) {
            throw new IllegalArgumentException("idempotencyKey is required");
        }
        if (request.reasonCode() == null || request.reasonCode().isBlank()) {
            throw new IllegalArgumentException("reasonCode is required");
        }
        if (request.amount() == null) {
            throw new IllegalArgumentException("amount is required");
        }
        BigDecimal amount = round3(request.amount());
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        return amount;
    }

    private String buildContextJson(LedgerContext context, Map<String, Object> extra) {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "unlock_id", context.unlockId());
        putIfPresent(map, "source_item_id", context.sourceItemId());
        putIfPresent(map, "source_page_id", context.sourcePageId());
        putIfPresent(map, "trace_id", context.traceId());
        if (context.metadata() != null) {
            context.metadata().forEach((key, value) -> putIfPresent(map, key, value));
        }
        if (extra != null) {
            extra.forEach((key, value) -> putIfPresent(map, key, value));
        }
        if (map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize ledger context: {}", e.getMessage());
            return null;
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String s && s.isBlank()) {
            return;
        }
        map.put(key, value);
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(20L * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private record WalletMutation(LedgerEntry entry, WalletSnapshot snapshot, boolean conflict, boolean insufficient) {

        static WalletMutation applied(LedgerEntry entry, WalletSnapshot snapshot) {
            return new WalletMutation(entry, snapshot, false, false);
        }

        static WalletMutation insufficient(WalletSnapshot snapshot) {
            return new WalletMutation(null, snapshot, false, true);
        }

        static WalletMutation lostRace() {
            return new WalletMutation(null, null, true, false);
        }
    }
}
