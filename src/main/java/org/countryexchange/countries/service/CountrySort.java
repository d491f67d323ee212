package org.countryexchange.countries.service;

import java.util.Arrays;
import java.util.Locale;

import org.countryexchange.countries.service.exception.InvalidRequestException;

/** Supported orderings for country listings. Unknown GDP always sorts last. */
public enum CountrySort {
  GDP_DESC("gdp_desc"),
  GDP_ASC("gdp_asc");

  private final String value;

  CountrySort(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a request parameter.
   *
   * @param value raw parameter, null or blank for the default
   * @return the matching sort, {@link #GDP_DESC} when unspecified
   * @throws InvalidRequestException for any other value
   */
  public static CountrySort fromValue(String value) {
    if (value == null || value.isBlank()) {
      return GDP_DESC;
    }

    var normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(sort -> sort.value.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Unsupported sort '" + value + "', expected gdp_desc or gdp_asc",
                    CountryServiceError.INVALID_SORT));
  }
}
