package uk.gegc.contentunlock.features.unlock.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockDto;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockRequest;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockResponse;
import uk.gegc.contentunlock.features.unlock.application.UnlockRequestResult;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.application.UnlockService;
import uk.gegc.contentunlock.features.unlock.infra.mapping.UnlockMapper;

import java.util.List;

@RestController
@RequestMapping("/api/v1/unlocks")
@RequiredArgsConstructor
@Validated
@Tag(name = "Unlocks", description = "Request unlocks and look up their state")
public class UnlockController {

    private final UnlockService unlockService;
    private final UnlockReservationStore reservationStore;
    private final UnlockMapper unlockMapper;

    @Operation(
            summary = "Request an unlock",
            description = "Reserves the item for the user, holds the unlock cost and enqueues generation. "
                    + "Repeating the request while the reservation is live does not hold credits again."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Outcome of the request",
                    content = @Content(schema = @Schema(implementation = UnlockResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    @PostMapping
    public ResponseEntity<UnlockResponse> requestUnlock(
            @Valid @RequestBody UnlockRequest request,
            @Parameter(description = "Trace id to correlate log events; generated when absent")
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        UnlockRequestResult result = unlockService.requestUnlock(
                request.userId(), request.sourceItemId(), request.sourcePageId(), traceId);
        return ResponseEntity.ok()
                .header("X-Trace-Id", result.traceId())
                .body(unlockMapper.toResponse(result));
    }

    @Operation(summary = "Look up unlocks by source item id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Unlocks found; unknown ids are omitted",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = UnlockDto.class))))
    })
    @GetMapping
    public ResponseEntity<List<UnlockDto>> findUnlocks(
            @RequestParam("sourceItemIds") @Size(min = 1, max = 200) List<String> sourceItemIds) {
        return ResponseEntity.ok(unlockMapper.toDtos(reservationStore.findBySourceItemIds(sourceItemIds)));
    }
}
