package org.countryexchange.countries.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.countryexchange.countries.fixture.CountryTestBuilder;
import org.countryexchange.countries.fixture.TestConstants;
import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.service.exception.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
@DisplayName("CountryService Unit Tests")
class CountryServiceTest {

  @Mock private CountryRepository countryRepository;

  private CountryService countryService;

  @BeforeEach
  void setUp() {
    countryService = new CountryService(countryRepository);
  }

  @Test
  @DisplayName("getByName - looks up by normalized name")
  void getByName_LooksUpByNormalizedName() {
    when(countryRepository.findByNameKey("nigeria"))
        .thenReturn(Optional.of(CountryTestBuilder.nigeria().build()));

    var result = countryService.getByName(" NIGERIA ");

    assertThat(result.name()).isEqualTo(TestConstants.NIGERIA);
    assertThat(result.currencyCode()).isEqualTo(TestConstants.NGN);
  }

  @Test
  @DisplayName("getByName - when missing - throws COUNTRY_NOT_FOUND")
  void getByName_WhenMissing_ThrowsNotFound() {
    when(countryRepository.findByNameKey("atlantis")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> countryService.getByName("Atlantis"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("Country not found: Atlantis")
        .extracting("code")
        .isEqualTo(CountryServiceError.COUNTRY_NOT_FOUND);
  }

  @Test
  @DisplayName("deleteByName - when nothing deleted - throws COUNTRY_NOT_FOUND")
  void deleteByName_WhenNothingDeleted_ThrowsNotFound() {
    when(countryRepository.deleteByNameKey("atlantis")).thenReturn(0);

    assertThatThrownBy(() -> countryService.deleteByName("Atlantis"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  @DisplayName("deleteByName - when deleted - completes")
  void deleteByName_WhenDeleted_Completes() {
    when(countryRepository.deleteByNameKey("ghana")).thenReturn(1);

    countryService.deleteByName("Ghana");
  }

  @Test
  @DisplayName("getStatus - before any refresh - zero count and no timestamp")
  void getStatus_BeforeRefresh_ZeroAndNull() {
    when(countryRepository.count()).thenReturn(0L);
    when(countryRepository.findLastRefreshedAt()).thenReturn(Optional.empty());

    var status = countryService.getStatus();

    assertThat(status.totalCountries()).isZero();
    assertThat(status.lastRefreshedAt()).isNull();
  }

  @Test
  @DisplayName("getStatus - with data - count and newest timestamp")
  void getStatus_WithData_CountAndTimestamp() {
    when(countryRepository.count()).thenReturn(250L);
    when(countryRepository.findLastRefreshedAt())
        .thenReturn(Optional.of(TestConstants.CYCLE_TIMESTAMP));

    var status = countryService.getStatus();

    assertThat(status.totalCountries()).isEqualTo(250);
    assertThat(status.lastRefreshedAt()).isEqualTo(TestConstants.CYCLE_TIMESTAMP);
  }
}
