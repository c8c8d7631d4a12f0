package uk.gegc.contentunlock.features.unlock.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.contentunlock.features.credits.infra.mapping.LedgerEntryMapper;
import uk.gegc.contentunlock.features.unlock.api.dto.SweepSummaryDto;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockDto;
import uk.gegc.contentunlock.features.unlock.api.dto.UnlockResponse;
import uk.gegc.contentunlock.features.unlock.application.SweepSummary;
import uk.gegc.contentunlock.features.unlock.application.UnlockRequestResult;
import uk.gegc.contentunlock.features.unlock.domain.model.Unlock;

import java.util.List;

@Mapper(componentModel = "spring", uses = LedgerEntryMapper.class, unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface UnlockMapper {

    UnlockDto toDto(Unlock unlock);

    List<UnlockDto> toDtos(List<Unlock> unlocks);

    UnlockResponse toResponse(UnlockRequestResult result);

    @Mapping(target = "expiredCandidates", source = "inspected.expiredCandidates")
    @Mapping(target = "processingCandidates", source = "inspected.processingCandidates")
    @Mapping(target = "runningJobs", source = "inspected.runningJobs")
    SweepSummaryDto toDto(SweepSummary summary);
}
