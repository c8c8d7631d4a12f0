package uk.gegc.contentunlock.features.credits.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.contentunlock.features.credits.api.dto.LedgerEntryDto;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent credit ledger. Every mutation is keyed; a replayed key returns the original
 * outcome and never moves the balance twice.
 */
public interface CreditLedgerService {

    /**
     * Debits {@code request.amount} and records a HOLD entry, or reports insufficient funds.
     */
    HoldResult reserveCredits(LedgerRequest request);

    /**
     * Finalizes a hold. When {@code heldAmount} is larger than the settle amount the
     * difference is credited back; a settle larger than the hold is rejected.
     *
     * @param heldAmount amount originally held, or {@code null} when it equals the settle amount
     */
    LedgerWriteResult settleReservation(LedgerRequest request, BigDecimal heldAmount);

    /**
     * Credits {@code request.amount} back, capped at wallet capacity.
     */
    LedgerWriteResult refundReservation(LedgerRequest request);

    WalletSnapshot getWallet(UUID userId);

    Optional<LedgerEntryDto> findEntry(String idempotencyKey);

    /**
     * Amount debited by a HOLD entry. Empty when the id is unknown or names another entry type.
     */
    Optional<BigDecimal> findHeldAmount(UUID holdLedgerId);

    Page<LedgerEntryDto> listEntries(UUID userId,
                                     LedgerEntryType type,
                                     LocalDateTime dateFrom,
                                     LocalDateTime dateTo,
                                     Pageable pageable);
}
