package uk.gegc.antidote.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CreditTransactionMapper {
    TransactionDto toDto(CreditTransaction entity);
    List<TransactionDto> toDtos(List<CreditTransaction> entities);
}
