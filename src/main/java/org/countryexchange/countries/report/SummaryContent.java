package org.countryexchange.countries.report;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.List;

/**
 * Everything drawn on the summary image.
 *
 * @param totalCountries stored country count
 * @param topCount number of ranks the summary lists at most
 * @param entries ranked entries, highest GDP first
 * @param asOf refresh cycle the summary describes
 */
public record SummaryContent(
    long totalCountries, int topCount, List<Entry> entries, Instant asOf) {

  /**
   * One ranked line.
   *
   * @param label full text, e.g. {@code 1. Nigeria - $1.2B}
   * @param flag thumbnail, null when unavailable
   */
  public record Entry(String label, BufferedImage flag) {}
}
