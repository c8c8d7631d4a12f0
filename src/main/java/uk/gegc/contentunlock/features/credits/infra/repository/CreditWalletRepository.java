package uk.gegc.contentunlock.features.credits.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.contentunlock.features.credits.domain.model.CreditWallet;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public interface CreditWalletRepository extends JpaRepository<CreditWallet, UUID> {

    /**
     * Writes a new balance only if nobody touched the wallet since {@code expectedVersion} was read.
     *
     * @return 1 when the write landed, 0 when the version moved on
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update CreditWallet w
           set w.balance = :balance,
               w.lastRefillAt = :lastRefillAt,
               w.updatedAt = :now,
               w.version = w.version + 1
         where w.userId = :userId
           and w.version = :expectedVersion
    """)
    int compareAndSetBalance(@Param("userId") UUID userId,
                             @Param("balance") BigDecimal balance,
                             @Param("lastRefillAt") LocalDateTime lastRefillAt,
                             @Param("now") LocalDateTime now,
                             @Param("expectedVersion") long expectedVersion);
}
