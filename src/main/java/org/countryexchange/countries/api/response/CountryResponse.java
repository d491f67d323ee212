package org.countryexchange.countries.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.countryexchange.countries.service.dto.CountryData;

/** Response DTO for a stored country. */
@Schema(description = "Country with its exchange rate and estimated GDP")
public record CountryResponse(
    @Schema(
            description = "Unique identifier",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long id,
    @Schema(
            description = "Country name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Nigeria")
        String name,
    @Schema(description = "Capital city", example = "Abuja") String capital,
    @Schema(description = "Region", example = "Africa") String region,
    @Schema(
            description = "Population",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "206139587")
        long population,
    @Schema(description = "First listed currency code", example = "NGN") String currencyCode,
    @Schema(description = "Units of the currency per US dollar", example = "1600.23")
        BigDecimal exchangeRate,
    @Schema(
            description =
                "Estimated GDP in US dollars. 0 when the country has no currency, null when"
                    + " unknown",
            example = "25767448125.20")
        BigDecimal estimatedGdp,
    @Schema(description = "Flag image URL", example = "https://flagcdn.com/ng.svg") String flagUrl,
    @Schema(
            description = "Timestamp of the refresh cycle that last wrote this country",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-22T18:00:00.123Z")
        Instant lastRefreshedAt) {

  /**
   * Create a response DTO from a service read model.
   *
   * @param data the country
   * @return CountryResponse
   */
  public static CountryResponse from(CountryData data) {
    return new CountryResponse(
        data.id(),
        data.name(),
        data.capital(),
        data.region(),
        data.population(),
        data.currencyCode(),
        data.exchangeRate(),
        data.estimatedGdp(),
        data.flagUrl(),
        data.lastRefreshedAt());
  }
}
