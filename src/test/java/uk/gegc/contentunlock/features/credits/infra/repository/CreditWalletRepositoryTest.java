package uk.gegc.contentunlock.features.credits.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.contentunlock.features.credits.domain.model.CreditWallet;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("CreditWalletRepository")
class CreditWalletRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Autowired
    private CreditWalletRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("compareAndSetBalance writes the balance and bumps the version")
    void compareAndSetBumpsVersion() {
        UUID userId = persistWallet("10.000");

        int updated = repository.compareAndSetBalance(userId, new BigDecimal("7.500"), NOW, NOW, 0L);

        assertThat(updated).isEqualTo(1);
        CreditWallet wallet = repository.findById(userId).orElseThrow();
        assertThat(wallet.getBalance()).isEqualByComparingTo("7.5");
        assertThat(wallet.getLastRefillAt()).isEqualTo(NOW);
        assertThat(wallet.getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("compareAndSetBalance rejects a stale version")
    void staleVersionRejected() {
        UUID userId = persistWallet("10.000");
        repository.compareAndSetBalance(userId, new BigDecimal("9.000"), NOW, NOW, 0L);

        int stale = repository.compareAndSetBalance(userId, new BigDecimal("1.000"), NOW, NOW, 0L);

        assertThat(stale).isZero();
        assertThat(repository.findById(userId).orElseThrow().getBalance()).isEqualByComparingTo("9");
    }

    @Test
    @DisplayName("compareAndSetBalance on a missing wallet touches nothing")
    void missingWallet() {
        assertThat(repository.compareAndSetBalance(UUID.randomUUID(), BigDecimal.ONE, NOW, NOW, 0L)).isZero();
    }

    private UUID persistWallet(String balance) {
        CreditWallet wallet = new CreditWallet();
        wallet.setUserId(UUID.randomUUID());
        wallet.setBalance(new BigDecimal(balance));
        wallet.setCapacity(new BigDecimal("10.000"));
        wallet.setRefillRatePerSec(new BigDecimal("0.002778"));
        wallet.setLastRefillAt(NOW.minusMinutes(5));
        wallet.setVersion(0L);
        wallet.setCreatedAt(NOW.minusDays(1));
        wallet.setUpdatedAt(NOW.minusMinutes(5));
        entityManager.persistAndFlush(wallet);
        entityManager.clear();
        return wallet.getUserId();
    }
}
