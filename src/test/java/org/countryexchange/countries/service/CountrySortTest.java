package org.countryexchange.countries.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import org.countryexchange.countries.service.exception.InvalidRequestException;

@DisplayName("CountrySort Unit Tests")
class CountrySortTest {

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  "})
  @DisplayName("fromValue - when unspecified - defaults to GDP descending")
  void fromValue_WhenUnspecified_DefaultsToGdpDesc(String value) {
    assertThat(CountrySort.fromValue(value)).isEqualTo(CountrySort.GDP_DESC);
  }

  @Test
  @DisplayName("fromValue - accepts both values case-insensitively")
  void fromValue_AcceptsKnownValuesIgnoringCase() {
    assertThat(CountrySort.fromValue("gdp_desc")).isEqualTo(CountrySort.GDP_DESC);
    assertThat(CountrySort.fromValue("GDP_ASC")).isEqualTo(CountrySort.GDP_ASC);
    assertThat(CountrySort.fromValue(" gdp_asc ")).isEqualTo(CountrySort.GDP_ASC);
  }

  @ParameterizedTest
  @ValueSource(strings = {"name", "gdp", "population_desc"})
  @DisplayName("fromValue - when value is unsupported - throws INVALID_SORT")
  void fromValue_WhenUnsupported_ThrowsInvalidRequest(String value) {
    assertThatThrownBy(() -> CountrySort.fromValue(value))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining(value)
        .extracting("code")
        .isEqualTo(CountryServiceError.INVALID_SORT);
  }
}
