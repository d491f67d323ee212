package org.countryexchange.countries.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.countryexchange.countries.service.dto.CountryStatus;

@Schema(description = "Stored country count and latest refresh time")
public record StatusResponse(
    @Schema(
            description = "Number of stored countries",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "250")
        long totalCountries,
    @Schema(
            description = "Newest refresh timestamp, null before the first refresh",
            example = "2025-10-22T18:00:00.123Z")
        Instant lastRefreshedAt) {

  public static StatusResponse from(CountryStatus status) {
    return new StatusResponse(status.totalCountries(), status.lastRefreshedAt());
  }
}
