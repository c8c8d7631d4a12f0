package uk.gegc.contentunlock.features.unlock.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.contentunlock.features.unlock.api.dto.SweepSummaryDto;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockDto;
import uk.gegc.contentunlock.features.unlock.application.SweepMode;
import uk.gegc.contentunlock.features.unlock.application.SweepRequest;
import uk.gegc.contentunlock.features.unlock.application.UnlockReliabilitySweepService;
import uk.gegc.contentunlock.features.unlock.application.UnlockReservationStore;
import uk.gegc.contentunlock.features.unlock.domain.exception.UnlockNotFoundException;
import uk.gegc.contentunlock.features.unlock.infra.mapping.UnlockMapper;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/unlocks")
@RequiredArgsConstructor
@Validated
@Tag(name = "Unlock Admin", description = "Operational endpoints for the unlock flow")
public class UnlockAdminController {

    private final UnlockReliabilitySweepService sweepService;
    private final UnlockReservationStore reservationStore;
    private final UnlockMapper unlockMapper;

    @Operation(
            summary = "Run the reliability sweep",
            description = "Recovers expired reservations, stale processing unlocks and orphan generation jobs. "
                    + "A sweep already running is joined instead of started again; force skips only the cooldown."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sweep summary (skipped runs carry a skip reason)",
                    content = @Content(schema = @Schema(implementation = SweepSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid tuning parameter")
    })
    @PostMapping("/sweep")
    public ResponseEntity<SweepSummaryDto> runSweep(
            @Parameter(description = "Ignore the minimum interval between sweeps")
            @RequestParam(defaultValue = "false") boolean force,
            @Parameter(description = "Rows per pass, 10 to 1000")
            @RequestParam(required = false) @Min(10) @Max(1000) Integer batchSize,
            @Parameter(description = "Age after which a running job with no active unlock is failed, in ms")
            @RequestParam(required = false) @Min(60_000) @Max(86_400_000) Long processingStaleMs,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        SweepRequest request = new SweepRequest(force, SweepMode.MANUAL, batchSize, processingStaleMs, null, traceId);
        return ResponseEntity.ok(unlockMapper.toDto(sweepService.runSweep(request)));
    }

    @Operation(summary = "Get an unlock by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Unlock found",
                    content = @Content(schema = @Schema(implementation = UnlockDto.class))),
            @ApiResponse(responseCode = "404", description = "Unlock not found")
    })
    @GetMapping("/{unlockId}")
    public ResponseEntity<UnlockDto> getUnlock(@PathVariable UUID unlockId) {
        return reservationStore.findById(unlockId)
                .map(unlockMapper::toDto)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new UnlockNotFoundException("Unlock " + unlockId + " not found"));
    }
}
