package uk.gegc.contentunlock.features.credits.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Structured logging for ledger writes. Fields go into MDC for the duration of one log call.
 */
public final class CreditStructuredLogger {

    private CreditStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
                                      UUID userId, String entryType, BigDecimal amount,
                                      String idempotencyKey, BigDecimal balanceAfter,
                                      String reasonCode, String traceId, Object... additionalArgs) {
        MDC.put("credits.userId", userId != null ? userId.toString() : null);
        MDC.put("credits.entryType", entryType);
        MDC.put("credits.amount", amount != null ? amount.toPlainString() : null);
        MDC.put("credits.idempotencyKey", idempotencyKey);
        MDC.put("credits.balanceAfter", balanceAfter != null ? balanceAfter.toPlainString() : null);
        MDC.put("credits.reasonCode", reasonCode);
        MDC.put("unlock.traceId", traceId);

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearCreditsMDC();
        }
    }

    public static void clearCreditsMDC() {
        MDC.remove("credits.userId");
        MDC.remove("credits.entryType");
        MDC.remove("credits.amount");
        MDC.remove("credits.idempotencyKey");
        MDC.remove("credits.balanceAfter");
        MDC.remove("credits.reasonCode");
        MDC.remove("unlock.traceId");
    }
}
