package uk.gegc.contentunlock.features.credits.application;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Credit wallet configuration (capacity, refill and bypass).
 */
@Configuration
@ConfigurationProperties(prefix = "credits.wallet")
@Validated
@Data
public class CreditWalletProperties {

    /**
     * Maximum balance a wallet can hold. Refill and refunds never push past it.
     */
    @DecimalMin("1")
    @DecimalMax("10000")
    private BigDecimal capacity = new BigDecimal("10");

    /**
     * Seconds it takes to refill one credit.
     */
    @Min(1)
    @Max(86_400)
    private int refillSecondsPerCredit = 360;

    /**
     * Balance given to a freshly created wallet. Defaults to the capacity.
     */
    @DecimalMin("0")
    private BigDecimal initialBalance;

    /**
     * When true holds always succeed, nothing is debited and no ledger rows are written.
     */
    private boolean bypass = false;

    /**
     * Compare-and-set attempts per wallet mutation before giving up.
     */
    @Min(1)
    @Max(20)
    private int maxCasAttempts = 5;

    public BigDecimal refillRatePerSec() {
        return BigDecimal.ONE.divide(BigDecimal.valueOf(refillSecondsPerCredit), 6, RoundingMode.HALF_UP);
    }

    public BigDecimal effectiveInitialBalance() {
        BigDecimal initial = initialBalance == null ? capacity : initialBalance.min(capacity);
        return initial.setScale(3, RoundingMode.HALF_UP);
    }
}
