package org.countryexchange.countries.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.random.RandomGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.countryexchange.countries.client.countries.response.CountryResponse;
import org.countryexchange.countries.client.exchange.response.ExchangeRateResponse;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.service.dto.RateTable;

/**
 * Joins raw countries against a rate table and derives the estimated GDP.
 *
 * <p>Outcomes per country:
 *
 * <ul>
 *   <li><b>No currency</b> (empty list, or first currency without a code): code and rate are null,
 *       GDP is exactly {@code 0}.
 *   <li><b>Code not quoted</b>: rate and GDP are null.
 *   <li><b>Rate is zero</b>: rate is {@code 0}, GDP is null.
 *   <li><b>Positive rate</b>: GDP is {@code population * multiplier / rate} with the multiplier
 *       drawn uniformly from {@code [1000, 2000)} for every country on every call.
 * </ul>
 *
 * <p>Only the first listed currency is considered. The random draw comes from the injected {@link
 * RandomGenerator}, so a seeded generator makes results reproducible.
 */
@Component
public class CountryEnricher {

  private static final Logger log = LoggerFactory.getLogger(CountryEnricher.class);

  static final double MIN_MULTIPLIER = 1000.0;
  static final double MAX_MULTIPLIER = 2000.0;

  private static final int GDP_SCALE = 2;

  private final RandomGenerator randomGenerator;

  public CountryEnricher(RandomGenerator randomGenerator) {
    this.randomGenerator = randomGenerator;
  }

  /**
   * Builds the rate table for a cycle. Null or negative rates are dropped.
   *
   * @param response exchange-rate payload
   * @return rate table keyed by upper-case currency code
   */
  public RateTable toRateTable(ExchangeRateResponse response) {
    var rates = new HashMap<String, BigDecimal>();

    response
        .rates()
        .forEach(
            (code, rate) -> {
              if (code == null || code.isBlank() || rate == null || rate.signum() < 0) {
                log.warn("Ignoring unusable exchange rate {} for currency '{}'", rate, code);
                return;
              }
              rates.put(code.trim().toUpperCase(Locale.ROOT), rate);
            });

    return new RateTable(rates);
  }

  /**
   * Enriches every raw country. Records without a name are skipped.
   *
   * @param raw countries in source order
   * @param rates rate table for the cycle
   * @param cycleTimestamp timestamp stamped on every result
   * @return enriched countries in source order
   */
  public List<Country> enrichAll(
      List<CountryResponse> raw, RateTable rates, Instant cycleTimestamp) {
    var enriched = new ArrayList<Country>(raw.size());

    for (var record : raw) {
      if (record == null || record.name() == null || record.name().isBlank()) {
        log.warn("Skipping country record without a name: {}", record);
        continue;
      }
      enriched.add(enrich(record, rates, cycleTimestamp));
    }

    return enriched;
  }

  /**
   * Enriches one raw country.
   *
   * @param raw country with a non-blank name
   * @param rates rate table for the cycle
   * @param cycleTimestamp timestamp stamped on the result
   * @return new, unsaved country
   */
  public Country enrich(CountryResponse raw, RateTable rates, Instant cycleTimestamp) {
    var country = new Country();
    country.setName(raw.name().trim());
    country.setCapital(raw.capital());
    country.setRegion(raw.region());
    country.setPopulation(populationOf(raw));
    country.setFlagUrl(raw.flag());
    country.setLastRefreshedAt(cycleTimestamp);

    var currencyCode = firstCurrencyCode(raw);
    if (currencyCode.isEmpty()) {
      country.setEstimatedGdp(BigDecimal.ZERO);
      return country;
    }

    country.setCurrencyCode(currencyCode.get());

    var rate = rates.rateFor(currencyCode.get());
    if (rate.isEmpty()) {
      log.debug("No exchange rate for {} ({})", currencyCode.get(), raw.name());
      return country;
    }

    country.setExchangeRate(rate.get());
    country.setEstimatedGdp(estimateGdp(country.getPopulation(), rate.get()).orElse(null));
    return country;
  }

  /**
   * Estimates GDP with a fresh random multiplier.
   *
   * @param population non-negative population
   * @param rate exchange rate
   * @return empty when the rate is zero, otherwise the estimate rounded to cents
   */
  public Optional<BigDecimal> estimateGdp(long population, BigDecimal rate) {
    if (rate.signum() == 0) {
      return Optional.empty();
    }

    var multiplier = randomGenerator.nextDouble(MIN_MULTIPLIER, MAX_MULTIPLIER);
    return Optional.of(
        BigDecimal.valueOf(population)
            .multiply(BigDecimal.valueOf(multiplier))
            .divide(rate, GDP_SCALE, RoundingMode.HALF_UP));
  }

  private Optional<String> firstCurrencyCode(CountryResponse raw) {
    var currencies = raw.currenciesOrEmpty();
    if (currencies.isEmpty() || currencies.get(0) == null) {
      return Optional.empty();
    }

    var code = currencies.get(0).code();
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(code.trim().toUpperCase(Locale.ROOT));
  }

  private long populationOf(CountryResponse raw) {
    if (raw.population() < 0) {
      log.warn("Negative population {} for {}, storing 0", raw.population(), raw.name());
      return 0;
    }
    return raw.population();
  }
}
