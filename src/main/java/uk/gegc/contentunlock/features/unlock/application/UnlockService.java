package uk.gegc.contentunlock.features.unlock.application;

import java.util.UUID;

public interface UnlockService {

    /**
     * Prices and reserves the item for {@code userId}, holds the credits and enqueues generation.
     * Calling it again for a live reservation of the same user returns RESERVED without a second hold.
     */
    UnlockRequestResult requestUnlock(UUID userId, String sourceItemId, String sourcePageId, String traceId);
}
