package uk.gegc.antidote.features.promo.application;

import uk.gegc.antidote.features.promo.api.dto.CreatePromoCodeRequest;
import uk.gegc.antidote.features.promo.api.dto.PromoCodeDto;

import java.util.List;

/**
 * Administration of promo codes. Every operation requires administrator privilege.
 */
public interface PromoCodeService {

    PromoCodeDto create(CreatePromoCodeRequest request);

    PromoCodeDto deactivate(String code);

    List<PromoCodeDto> listActive();
}
