package uk.gegc.contentunlock.features.credits.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.contentunlock.features.credits.api.dto.LedgerEntryDto;
import uk.gegc.contentunlock.features.credits.api.dto.WalletDto;
import uk.gegc.contentunlock.features.credits.application.CreditLedgerService;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntryType;
import uk.gegc.contentunlock.features.credits.infra.mapping.LedgerEntryMapper;

import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/credits")
@RequiredArgsConstructor
@Tag(name = "Credits Admin", description = "Ledger audit and wallet inspection")
public class CreditAdminController {

    private final CreditLedgerService creditLedgerService;
    private final LedgerEntryMapper ledgerEntryMapper;

    @Operation(
            summary = "Export ledger entries",
            description = "Pages through ledger entries, newest first, optionally filtered by user, entry type and creation time."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of ledger entries"),
            @ApiResponse(responseCode = "400", description = "Invalid filter")
    })
    @GetMapping("/ledger")
    public ResponseEntity<Page<LedgerEntryDto>> listLedgerEntries(
            @Parameter(description = "Only entries of this user") @RequestParam(required = false) UUID userId,
            @Parameter(description = "Only entries of this type") @RequestParam(required = false) LedgerEntryType type,
            @Parameter(description = "Created at or after (ISO date-time)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "Created at or before (ISO date-time)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @PageableDefault(size = 50) Pageable pageable) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        return ResponseEntity.ok(creditLedgerService.listEntries(userId, type, from, to, pageable));
    }

    @Operation(summary = "Get a wallet snapshot", description = "Balance with refill applied up to now. Read-only.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Wallet snapshot",
                    content = @Content(schema = @Schema(implementation = WalletDto.class)))
    })
    @GetMapping("/wallets/{userId}")
    public ResponseEntity<WalletDto> getWallet(@PathVariable UUID userId) {
        return ResponseEntity.ok(ledgerEntryMapper.toDto(creditLedgerService.getWallet(userId)));
    }
}
