package org.countryexchange.countries.service.dto;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Currency code to exchange rate snapshot for one refresh cycle. Codes are stored upper-case and
 * every rate is zero or positive.
 */
public record RateTable(Map<String, BigDecimal> rates) {

  public RateTable {
    rates = Map.copyOf(rates);
  }

  public Optional<BigDecimal> rateFor(String currencyCode) {
    if (currencyCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rates.get(currencyCode.toUpperCase(Locale.ROOT)));
  }

  public int size() {
    return rates.size();
  }
}
