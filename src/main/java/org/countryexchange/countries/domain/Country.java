package org.countryexchange.countries.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * Country entity holding the merged snapshot of a country's metadata and the exchange-rate derived
 * values computed during the last refresh cycle that touched it.
 *
 * <p>Rows are merged by {@link #nameKey}, the lower-cased trimmed country name, so lookups and
 * deletes by name are case-insensitive.
 *
 * <p>{@code estimatedGdp} distinguishes two absent-looking states: {@code 0} means the country has
 * no usable currency, {@code null} means the value is unknown (currency not quoted or rate zero).
 */
@Entity
@Table(name = "countries")
public class Country {

  /** Unique identifier for the country. */
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  /** Country name as reported by the country directory. */
  @Column(nullable = false)
  @NotNull
  private String name;

  /** Case-insensitive merge key derived from the name. */
  @Column(name = "name_key", nullable = false, unique = true)
  private String nameKey;

  private String capital;

  private String region;

  @Column(nullable = false)
  private long population;

  /** First currency code listed for the country, if any. */
  @Column(name = "currency_code", length = 10)
  private String currencyCode;

  /** Units of the currency per US dollar at refresh time. */
  @Column(name = "exchange_rate", precision = 20, scale = 8)
  private BigDecimal exchangeRate;

  @Column(name = "estimated_gdp", precision = 30, scale = 2)
  private BigDecimal estimatedGdp;

  @Column(name = "flag_url", length = 512)
  private String flagUrl;

  /** Timestamp of the refresh cycle that last wrote this row. */
  @Column(name = "last_refreshed_at", nullable = false)
  private Instant lastRefreshedAt;

  /**
   * Derives the merge key for a country name.
   *
   * @param name country name, any case
   * @return trimmed, lower-cased name, or null when name is null
   */
  public static String nameKeyOf(String name) {
    if (name == null) {
      return null;
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
    this.nameKey = nameKeyOf(name);
  }

  public String getNameKey() {
    return nameKey;
  }

  public String getCapital() {
    return capital;
  }

  public void setCapital(String capital) {
    this.capital = capital;
  }

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  public long getPopulation() {
    return population;
  }

  public void setPopulation(long population) {
    this.population = population;
  }

  public String getCurrencyCode() {
    return currencyCode;
  }

  public void setCurrencyCode(String currencyCode) {
    this.currencyCode = currencyCode;
  }

  public BigDecimal getExchangeRate() {
    return exchangeRate;
  }

  public void setExchangeRate(BigDecimal exchangeRate) {
    this.exchangeRate = exchangeRate;
  }

  public BigDecimal getEstimatedGdp() {
    return estimatedGdp;
  }

  public void setEstimatedGdp(BigDecimal estimatedGdp) {
    this.estimatedGdp = estimatedGdp;
  }

  public String getFlagUrl() {
    return flagUrl;
  }

  public void setFlagUrl(String flagUrl) {
    this.flagUrl = flagUrl;
  }

  public Instant getLastRefreshedAt() {
    return lastRefreshedAt;
  }

  public void setLastRefreshedAt(Instant lastRefreshedAt) {
    this.lastRefreshedAt = lastRefreshedAt;
  }
}
