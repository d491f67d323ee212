package org.countryexchange.countries.report;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("GdpFormatter Unit Tests")
class GdpFormatterTest {

  @Test
  @DisplayName("format - when GDP is unknown - N/A")
  void format_WhenNull_ReturnsNotAvailable() {
    assertThat(GdpFormatter.format(null)).isEqualTo("N/A");
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "0, 0",
    "0.00, 0",
    "999.50, 999.5",
    "1000, 1.0K",
    "1249.99, 1.2K",
    "1250, 1.3K",
    "999999, 1000.0K",
    "1000000, 1.0M",
    "34567890.12, 34.6M",
    "1000000000, 1.0B",
    "1234567890123.45, 1234.6B"
  })
  @DisplayName("format - uses one decimal with K/M/B suffix from a thousand upward")
  void format_UsesSuffixFromThousandUpward(String value, String expected) {
    assertThat(GdpFormatter.format(new BigDecimal(value))).isEqualTo(expected);
  }
}
