package uk.gegc.contentunlock.features.credits.domain.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class SettleExceedsHoldException extends RuntimeException {

    private final BigDecimal settleAmount;
    private final BigDecimal heldAmount;

    public SettleExceedsHoldException(BigDecimal settleAmount, BigDecimal heldAmount) {
        super("Settle amount " + settleAmount.toPlainString() + " exceeds held amount " + heldAmount.toPlainString());
        this.settleAmount = settleAmount;
        this.heldAmount = heldAmount;
    }
}
