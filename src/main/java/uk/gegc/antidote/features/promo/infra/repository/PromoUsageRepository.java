package uk.gegc.antidote.features.promo.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.antidote.features.promo.domain.model.PromoUsage;
import uk.gegc.antidote.features.promo.domain.model.PromoUsageStatus;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface PromoUsageRepository extends JpaRepository<PromoUsage, UUID> {

    long countByClinicIdAndPromoCodeIdAndStatusIn(Long clinicId, UUID promoCodeId, Collection<PromoUsageStatus> statuses);

    Optional<PromoUsage> findByTransactionId(UUID transactionId);
}
