package org.countryexchange.countries.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Compact GDP labels for the summary image: {@code 1.2B}, {@code 34.5M}, {@code 6.7K}. */
public final class GdpFormatter {

  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
  private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
  private static final BigDecimal BILLION = BigDecimal.valueOf(1_000_000_000L);

  static final String UNKNOWN = "N/A";

  private GdpFormatter() {}

  /**
   * Formats a GDP value with one decimal and a K/M/B suffix from 1e3 upward. Smaller values are
   * printed as-is without trailing zeros.
   *
   * @param gdp value, may be null
   * @return label, {@code N/A} for null
   */
  public static String format(BigDecimal gdp) {
    if (gdp == null) {
      return UNKNOWN;
    }

    if (gdp.compareTo(BILLION) >= 0) {
      return scaled(gdp, BILLION) + "B";
    }
    if (gdp.compareTo(MILLION) >= 0) {
      return scaled(gdp, MILLION) + "M";
    }
    if (gdp.compareTo(THOUSAND) >= 0) {
      return scaled(gdp, THOUSAND) + "K";
    }
    return gdp.stripTrailingZeros().toPlainString();
  }

  private static String scaled(BigDecimal gdp, BigDecimal unit) {
    return gdp.divide(unit, 1, RoundingMode.HALF_UP).toPlainString();
  }
}
