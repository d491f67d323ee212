package org.countryexchange.countries.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

import org.countryexchange.countries.domain.Country;

/** Read model for a stored country, safe to cache. */
public record CountryData(
    Long id,
    String name,
    String capital,
    String region,
    long population,
    String currencyCode,
    BigDecimal exchangeRate,
    BigDecimal estimatedGdp,
    String flagUrl,
    Instant lastRefreshedAt) {

  public static CountryData from(Country country) {
    return new CountryData(
        country.getId(),
        country.getName(),
        country.getCapital(),
        country.getRegion(),
        country.getPopulation(),
        country.getCurrencyCode(),
        country.getExchangeRate(),
        country.getEstimatedGdp(),
        country.getFlagUrl(),
        country.getLastRefreshedAt());
  }
}
