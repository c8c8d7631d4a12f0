package uk.gegc.contentunlock.features.unlock.application;

import uk.gegc.contentunlock.features.credits.application.WalletSnapshot;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.util.UUID;

/**
 * Answer to an unlock request.
 *
 * @param jobId  generation job enqueued by this request, null unless it reserved the unlock
 * @param wallet wallet after the hold (or the failed hold), null when no hold was attempted
 */
public record UnlockRequestResult(
        State state,
        Unlock unlock,
        UUID jobId,
        WalletSnapshot wallet,
        String traceId
) {
    public enum State {
        READY,
        IN_PROGRESS,
        RESERVED,
        INSUFFICIENT_CREDITS
    }
}
