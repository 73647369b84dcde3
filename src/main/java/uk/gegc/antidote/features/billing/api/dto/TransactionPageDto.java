package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "TransactionPage")
public record TransactionPageDto(
        List<TransactionDto> items,
        @Schema(description = "Pass back as pageToken to fetch the next page; absent on the last page")
        String nextPageToken
) {
}
