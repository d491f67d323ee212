package org.countryexchange.countries.service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.countryexchange.countries.client.countries.RestCountriesClient;
import org.countryexchange.countries.client.countries.response.CountryResponse;
import org.countryexchange.countries.client.exchange.ExchangeRateClient;
import org.countryexchange.countries.client.exchange.response.ExchangeRateResponse;
import org.countryexchange.countries.config.RefreshExecutorConfig;
import org.countryexchange.countries.report.SummaryImageGenerator;
import org.countryexchange.countries.service.dto.RefreshOutcome;
import org.countryexchange.countries.service.dto.RefreshTicket;
import org.countryexchange.countries.service.exception.RefreshRejectedException;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/**
 * Runs refresh cycles: fetch both sources, enrich, persist, then regenerate the summary image.
 *
 * <p><b>Phases:</b>
 *
 * <ol>
 *   <li><b>Precheck</b> (caller's thread): both sources are fetched. A failure is thrown to the
 *       caller as {@link SourceUnavailableException} and nothing is written.
 *   <li><b>Dispatch</b>: the cycle timestamp is taken and the rest of the work is queued on the
 *       refresh pool. The caller gets a {@link RefreshTicket} without waiting.
 *   <li><b>Execute</b> (refresh pool): the precheck payloads are enriched, persisted in chunks and
 *       the summary image is written. Failures here are logged and recorded as metrics; they only
 *       reach the ticket's future, which production callers ignore.
 * </ol>
 *
 * <p>The summary image is attempted even when persistence fails, so it reflects whatever prefix
 * was committed. Nothing serializes overlapping cycles.
 */
@Service
public class CountryRefreshService {

  private static final Logger log = LoggerFactory.getLogger(CountryRefreshService.class);

  private final RestCountriesClient restCountriesClient;
  private final ExchangeRateClient exchangeRateClient;
  private final CountryEnricher countryEnricher;
  private final CountryBatchPersister countryBatchPersister;
  private final SummaryImageGenerator summaryImageGenerator;
  private final Executor refreshExecutor;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public CountryRefreshService(
      RestCountriesClient restCountriesClient,
      ExchangeRateClient exchangeRateClient,
      CountryEnricher countryEnricher,
      CountryBatchPersister countryBatchPersister,
      SummaryImageGenerator summaryImageGenerator,
      @Qualifier(RefreshExecutorConfig.COUNTRY_REFRESH_EXECUTOR) Executor refreshExecutor,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.restCountriesClient = restCountriesClient;
    this.exchangeRateClient = exchangeRateClient;
    this.countryEnricher = countryEnricher;
    this.countryBatchPersister = countryBatchPersister;
    this.summaryImageGenerator = summaryImageGenerator;
    this.refreshExecutor = refreshExecutor;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Starts a refresh cycle.
   *
   * @return ticket for the queued cycle
   * @throws SourceUnavailableException when either source cannot be fetched; nothing is queued
   * @throws RefreshRejectedException when the refresh pool is saturated
   */
  public RefreshTicket refresh() {
    var countries = restCountriesClient.fetchAll();
    var rates = exchangeRateClient.fetchLatest();

    var cycleTimestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    log.info(
        "Precheck passed with {} countries and {} rates, dispatching refresh cycle {}",
        countries.size(),
        rates.rates().size(),
        cycleTimestamp);

    try {
      var completion =
          CompletableFuture.supplyAsync(
              () -> execute(countries, rates, cycleTimestamp), refreshExecutor);
      return new RefreshTicket(cycleTimestamp, completion);
    } catch (RejectedExecutionException e) {
      log.warn("Refresh cycle {} rejected, refresh pool is saturated", cycleTimestamp);
      meterRegistry.counter("country.refresh.cycle.rejected").increment();
      throw new RefreshRejectedException("Too many refreshes in progress, try again later", e);
    }
  }

  private RefreshOutcome execute(
      List<CountryResponse> countries, ExchangeRateResponse rates, Instant cycleTimestamp) {
    var sample = Timer.start(meterRegistry);

    try {
      var rateTable = countryEnricher.toRateTable(rates);
      var enriched = countryEnricher.enrichAll(countries, rateTable, cycleTimestamp);
      log.info("Enriched {} countries for refresh cycle {}", enriched.size(), cycleTimestamp);

      var affected = 0;
      RuntimeException persistFailure = null;
      try {
        affected = countryBatchPersister.persist(enriched);
      } catch (RuntimeException e) {
        // the summary still gets regenerated from whatever was committed
        persistFailure = e;
      }

      var reportGenerated = generateReport(cycleTimestamp);

      if (persistFailure != null) {
        throw persistFailure;
      }

      log.info(
          "Refresh cycle {} completed: {} countries, {} rows affected, summary image {}",
          cycleTimestamp,
          enriched.size(),
          affected,
          reportGenerated ? "written" : "not written");
      record(sample, "success", null);
      return new RefreshOutcome(cycleTimestamp, enriched.size(), affected, reportGenerated);
    } catch (RuntimeException e) {
      log.error("Refresh cycle {} failed: {}", cycleTimestamp, e.getMessage(), e);
      record(sample, "failure", e);
      throw e;
    }
  }

  private boolean generateReport(Instant cycleTimestamp) {
    try {
      return summaryImageGenerator.generate(cycleTimestamp);
    } catch (RuntimeException e) {
      log.error("Refresh cycle {} failed to generate summary image", cycleTimestamp, e);
      meterRegistry.counter("country.refresh.report.failures").increment();
      return false;
    }
  }

  private void record(Timer.Sample sample, String status, Exception e) {
    var error = e == null ? "none" : e.getClass().getSimpleName();

    sample.stop(
        Timer.builder("country.refresh.cycle.duration")
            .tag("status", status)
            .tag("error", error)
            .register(meterRegistry));

    meterRegistry
        .counter("country.refresh.cycle.executions", "status", status, "error", error)
        .increment();
  }
}
