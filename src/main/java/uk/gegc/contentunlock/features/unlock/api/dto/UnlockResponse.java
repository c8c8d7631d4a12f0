package uk.gegc.contentunlock.features.unlock.api.dto;

import uk.gegc.contentunlock.features.credits.api.dto.WalletDto;
import uk.gegc.contentunlock.features.unlock.application.UnlockRequestResult;

import java.util.UUID;

public record UnlockResponse(
        UnlockRequestResult.State state,
        UnlockDto unlock,
        UUID jobId,
        WalletDto wallet,
        String traceId
) {}
