package uk.gegc.antidote.features.promo.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.antidote.features.promo.api.dto.PromoCodeDto;
import uk.gegc.antidote.features.promo.domain.model.PromoCode;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PromoCodeMapper {
    PromoCodeDto toDto(PromoCode entity);
    List<PromoCodeDto> toDtos(List<PromoCode> entities);
}
