package uk.gegc.contentunlock.features.unlock.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "UnlockRequest", description = "Request to unlock a source item for a user")
public record UnlockRequest(
        @Schema(description = "User paying for the unlock", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull UUID userId,

        @Schema(description = "Item to unlock", example = "item-42", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 200) String sourceItemId,

        @Schema(description = "Grouping key used for pricing", example = "page-7")
        @Size(max = 200) String sourcePageId
) {}
