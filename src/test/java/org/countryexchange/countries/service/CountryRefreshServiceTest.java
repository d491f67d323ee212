package org.countryexchange.countries.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.countryexchange.countries.client.SourceName;
import org.countryexchange.countries.client.countries.RestCountriesClient;
import org.countryexchange.countries.client.countries.response.CountryResponse;
import org.countryexchange.countries.client.countries.response.CurrencyResponse;
import org.countryexchange.countries.client.exchange.ExchangeRateClient;
import org.countryexchange.countries.client.exchange.response.ExchangeRateResponse;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.fixture.TestConstants;
import org.countryexchange.countries.report.SummaryImageGenerator;
import org.countryexchange.countries.service.exception.BatchPersistenceException;
import org.countryexchange.countries.service.exception.RefreshRejectedException;
import org.countryexchange.countries.service.exception.ReportGenerationException;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/**
 * Unit tests for {@link CountryRefreshService}.
 *
 * <p>The refresh pool is replaced by a caller-runs executor so the detached phase completes before
 * {@code refresh()} returns.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CountryRefreshService Unit Tests")
class CountryRefreshServiceTest {

  private static final Instant NOW = Instant.parse("2025-10-22T18:00:00.123456Z");

  private static final List<CountryResponse> COUNTRIES =
      List.of(
          new CountryResponse(
              TestConstants.NIGERIA,
              "Abuja",
              "Africa",
              206_139_589L,
              List.of(new CurrencyResponse(TestConstants.NGN, "Naira", "₦")),
              TestConstants.NIGERIA_FLAG,
              false),
          new CountryResponse(
              TestConstants.ANTARCTICA, null, "Polar", 1000L, List.of(), null, false));

  private static final ExchangeRateResponse RATES =
      new ExchangeRateResponse(
          "success",
          "USD",
          Map.of("USD", BigDecimal.ONE, TestConstants.NGN, TestConstants.NGN_RATE));

  // ===========================================================================================
  // Test Dependencies
  // ===========================================================================================

  @Mock private RestCountriesClient restCountriesClient;

  @Mock private ExchangeRateClient exchangeRateClient;

  @Mock private CountryBatchPersister countryBatchPersister;

  @Mock private SummaryImageGenerator summaryImageGenerator;

  private MeterRegistry meterRegistry;

  private CountryRefreshService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = newService(Runnable::run);
  }

  // ===========================================================================================
  // Precheck
  // ===========================================================================================

  @Test
  @DisplayName("refresh - when rates source fails - throws and writes nothing")
  void refresh_WhenRatesSourceFails_ThrowsAndWritesNothing() {
    // Arrange
    when(restCountriesClient.fetchAll()).thenReturn(COUNTRIES);
    when(exchangeRateClient.fetchLatest())
        .thenThrow(
            new SourceUnavailableException(
                SourceName.EXCHANGE_RATES, "Could not fetch data from exchange rates source"));

    // Act & Assert
    assertThatThrownBy(() -> service.refresh())
        .isInstanceOf(SourceUnavailableException.class)
        .extracting("source")
        .isEqualTo(SourceName.EXCHANGE_RATES);

    verifyNoInteractions(countryBatchPersister, summaryImageGenerator);
  }

  @Test
  @DisplayName("refresh - when countries source fails - rates are not fetched")
  void refresh_WhenCountriesSourceFails_RatesNotFetched() {
    when(restCountriesClient.fetchAll())
        .thenThrow(
            new SourceUnavailableException(
                SourceName.COUNTRIES, "Could not fetch data from country directory source"));

    assertThatThrownBy(() -> service.refresh())
        .isInstanceOf(SourceUnavailableException.class)
        .extracting("source")
        .isEqualTo(SourceName.COUNTRIES);

    verifyNoInteractions(exchangeRateClient, countryBatchPersister, summaryImageGenerator);
  }

  // ===========================================================================================
  // Execute
  // ===========================================================================================

  @Test
  @DisplayName("refresh - when successful - stamps one millisecond timestamp on every country")
  void refresh_WhenSuccessful_StampsOneTimestamp() {
    // Arrange
    stubSources();
    when(countryBatchPersister.persist(anyList())).thenReturn(2);
    when(summaryImageGenerator.generate(any(Instant.class))).thenReturn(true);

    // Act
    var ticket = service.refresh();

    // Assert
    var expected = Instant.parse("2025-10-22T18:00:00.123Z");
    assertThat(ticket.cycleTimestamp()).isEqualTo(expected);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Country>> captor = ArgumentCaptor.forClass(List.class);
    verify(countryBatchPersister).persist(captor.capture());
    assertThat(captor.getValue())
        .hasSize(2)
        .allSatisfy(c -> assertThat(c.getLastRefreshedAt()).isEqualTo(expected));
    verify(summaryImageGenerator).generate(expected);

    var outcome = ticket.completion().join();
    assertThat(outcome.enrichedCount()).isEqualTo(2);
    assertThat(outcome.affectedRows()).isEqualTo(2);
    assertThat(outcome.reportGenerated()).isTrue();

    var executions =
        meterRegistry
            .find("country.refresh.cycle.executions")
            .tag("status", "success")
            .counter();
    assertThat(executions).isNotNull();
    assertThat(executions.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("refresh - when persistence fails - summary still attempted and cycle fails")
  void refresh_WhenPersistenceFails_SummaryStillAttempted() {
    // Arrange
    stubSources();
    var failure = new BatchPersistenceException(2, 3, 100, new IllegalStateException("boom"));
    when(countryBatchPersister.persist(anyList())).thenThrow(failure);
    when(summaryImageGenerator.generate(any(Instant.class))).thenReturn(true);

    // Act
    var ticket = service.refresh();

    // Assert
    verify(summaryImageGenerator).generate(ticket.cycleTimestamp());
    assertThatThrownBy(() -> ticket.completion().join())
        .isInstanceOf(CompletionException.class)
        .hasCause(failure);

    var failures =
        meterRegistry
            .find("country.refresh.cycle.executions")
            .tag("status", "failure")
            .tag("error", "BatchPersistenceException")
            .counter();
    assertThat(failures).isNotNull();
    assertThat(failures.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("refresh - when summary fails - cycle succeeds without a report")
  void refresh_WhenSummaryFails_CycleSucceedsWithoutReport() {
    stubSources();
    when(countryBatchPersister.persist(anyList())).thenReturn(2);
    when(summaryImageGenerator.generate(any(Instant.class)))
        .thenThrow(new ReportGenerationException("disk full", new RuntimeException()));

    var outcome = service.refresh().completion().join();

    assertThat(outcome.reportGenerated()).isFalse();
    assertThat(outcome.affectedRows()).isEqualTo(2);
    assertThat(meterRegistry.find("country.refresh.report.failures").counter().count())
        .isEqualTo(1);
  }

  @Test
  @DisplayName("refresh - when the pool rejects the cycle - throws RefreshRejectedException")
  void refresh_WhenPoolRejects_ThrowsRefreshRejected() {
    // Arrange
    stubSources();
    service =
        newService(
            task -> {
              throw new RejectedExecutionException("queue full");
            });

    // Act & Assert
    assertThatThrownBy(() -> service.refresh())
        .isInstanceOf(RefreshRejectedException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);

    verify(countryBatchPersister, never()).persist(anyList());
    assertThat(meterRegistry.find("country.refresh.cycle.rejected").counter().count())
        .isEqualTo(1);
  }

  private void stubSources() {
    when(restCountriesClient.fetchAll()).thenReturn(COUNTRIES);
    when(exchangeRateClient.fetchLatest()).thenReturn(RATES);
  }

  private CountryRefreshService newService(Executor executor) {
    return new CountryRefreshService(
        restCountriesClient,
        exchangeRateClient,
        new CountryEnricher(new Random(42L)),
        countryBatchPersister,
        summaryImageGenerator,
        executor,
        Clock.fixed(NOW, ZoneOffset.UTC),
        meterRegistry);
  }
}
