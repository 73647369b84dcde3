package uk.gegc.antidote.features.dispute.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.antidote.features.dispute.api.dto.DisputeDto;
import uk.gegc.antidote.features.dispute.api.dto.DisputeStatusChangeDto;
import uk.gegc.antidote.features.dispute.domain.model.DisputeStatusChange;
import uk.gegc.antidote.features.dispute.domain.model.LeadDispute;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface DisputeMapper {
    DisputeDto toDto(LeadDispute entity);
    List<DisputeDto> toDtos(List<LeadDispute> entities);

    DisputeStatusChangeDto toDto(DisputeStatusChange entity);
    List<DisputeStatusChangeDto> toChangeDtos(List<DisputeStatusChange> entities);
}
