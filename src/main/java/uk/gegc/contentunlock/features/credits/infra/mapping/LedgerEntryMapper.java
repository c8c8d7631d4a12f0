package uk.gegc.contentunlock.features.credits.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.contentunlock.features.credits.api.dto.LedgerEntryDto;
import uk.gegc.contentunlock.features.credits.api.dto.WalletDto;
import uk.gegc.contentunlock.features.credits.application.WalletSnapshot;
import uk.gegc.contentunlock.features.credits.domain.model.LedgerEntry;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LedgerEntryMapper {
    LedgerEntryDto toDto(LedgerEntry entity);

    List<LedgerEntryDto> toDtos(List<LedgerEntry> entities);

    WalletDto toDto(WalletSnapshot snapshot);
}
