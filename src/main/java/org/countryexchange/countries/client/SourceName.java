package org.countryexchange.countries.client;

/** Upstream sources consulted by a refresh cycle. */
public enum SourceName {
  COUNTRIES("country directory"),
  EXCHANGE_RATES("exchange rates");

  private final String description;

  SourceName(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
