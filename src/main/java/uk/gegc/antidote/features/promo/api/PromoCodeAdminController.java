package uk.gegc.antidote.features.promo.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.antidote.features.promo.api.dto.CreatePromoCodeRequest;
import uk.gegc.antidote.features.promo.api.dto.PromoCodeDto;
import uk.gegc.antidote.features.promo.application.PromoCodeService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/billing/promo-codes")
@RequiredArgsConstructor
@PreAuthorize("hasAuthority('BILLING_ADMIN')")
@Tag(name = "Promo Code Administration")
@SecurityRequirement(name = "Basic Authentication")
public class PromoCodeAdminController {

    private final PromoCodeService promoCodeService;

    @Operation(summary = "Create a promo code")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Promo code created",
                    content = @Content(schema = @Schema(implementation = PromoCodeDto.class))),
            @ApiResponse(responseCode = "409", description = "Code already exists",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<PromoCodeDto> create(@Valid @RequestBody CreatePromoCodeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(promoCodeService.create(request));
    }

    @Operation(summary = "List active promo codes")
    @ApiResponse(responseCode = "200", description = "Active codes",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = PromoCodeDto.class))))
    @GetMapping
    public ResponseEntity<List<PromoCodeDto>> listActive() {
        return ResponseEntity.ok(promoCodeService.listActive());
    }

    @Operation(summary = "Deactivate a promo code", description = "Reservations already made still settle.")
    @ApiResponse(responseCode = "200", description = "Promo code deactivated",
            content = @Content(schema = @Schema(implementation = PromoCodeDto.class)))
    @DeleteMapping("/{code}")
    public ResponseEntity<PromoCodeDto> deactivate(@PathVariable String code) {
        return ResponseEntity.ok(promoCodeService.deactivate(code));
    }
}
