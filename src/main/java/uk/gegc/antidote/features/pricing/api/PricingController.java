package uk.gegc.antidote.features.pricing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.antidote.features.pricing.api.dto.PriceTableDto;
import uk.gegc.antidote.features.pricing.api.dto.PriceTierDto;
import uk.gegc.antidote.features.pricing.application.PricingEngine;

@RestController
@RequestMapping("/api/v1/billing/pricing")
@RequiredArgsConstructor
@Tag(name = "Pricing", description = "Lead price table")
public class PricingController {

    private final PricingEngine pricingEngine;

    @Operation(summary = "Active price tiers", description = "Package value bands and their credit cost per lead")
    @GetMapping("/tiers")
    public ResponseEntity<PriceTableDto> getTiers() {
        var tiers = pricingEngine.tiers().stream()
                .map(t -> new PriceTierDto(t.lowerInclusive(), t.upperExclusive(), t.credits()))
                .toList();
        return ResponseEntity.ok(new PriceTableDto(pricingEngine.version(), tiers));
    }
}
