package org.countryexchange.countries.client.countries.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One country from the country directory.
 *
 * @param name country name
 * @param capital capital city, may be null
 * @param region region, may be null
 * @param population population count
 * @param currencies currencies in source order, null or empty when the country has none
 * @param flag flag image URL, may be null
 * @param independent independence flag, not used by the refresh
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CountryResponse(
    String name,
    String capital,
    String region,
    long population,
    List<CurrencyResponse> currencies,
    String flag,
    Boolean independent) {

  public List<CurrencyResponse> currenciesOrEmpty() {
    return currencies == null ? List.of() : currencies;
  }
}
