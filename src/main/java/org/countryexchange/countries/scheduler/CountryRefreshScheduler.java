package org.countryexchange.countries.scheduler;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.service.CountryRefreshService;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/**
 * Triggers the periodic country refresh.
 *
 * <p>Only the synchronous part of a refresh is observed here: a precheck failure or a rejected
 * dispatch is retried after the configured delay. Failures inside the detached cycle are handled
 * by {@link CountryRefreshService}.
 */
@Component
public class CountryRefreshScheduler {

  private static final Logger log = LoggerFactory.getLogger(CountryRefreshScheduler.class);

  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final CountryServiceProperties properties;
  private final CountryRefreshService countryRefreshService;

  public CountryRefreshScheduler(
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      CountryServiceProperties properties,
      CountryRefreshService countryRefreshService) {

    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.countryRefreshService = countryRefreshService;
  }

  @Scheduled(cron = "${country-service.refresh.cron:0 0 2 * * ?}", zone = "UTC")
  @SchedulerLock(name = "countryRefresh", lockAtMostFor = "15m", lockAtLeastFor = "1m")
  public void refreshCountries() {
    var retryConfig = properties.getRefresh().getRetry();

    log.info(
        "Starting scheduled country refresh (max attempts: {}, delay: {} minutes)",
        retryConfig.getMaxAttempts(),
        retryConfig.getDelayMinutes());

    triggerRefresh(1);
  }

  private void triggerRefresh(int attemptNumber) {
    var sample = Timer.start(meterRegistry);

    try {
      var ticket = countryRefreshService.refresh();
      log.info(
          "Scheduled country refresh dispatched on attempt {} as cycle {}",
          attemptNumber,
          ticket.cycleTimestamp());

      recordSuccess(sample, attemptNumber);
    } catch (Exception e) {
      var maxAttempts = properties.getRefresh().getRetry().getMaxAttempts();

      if (e instanceof SourceUnavailableException sue) {
        log.error(
            "Country refresh precheck failed on attempt {}/{}, {} source unavailable: {}",
            attemptNumber,
            maxAttempts,
            sue.getSource(),
            e.getMessage(),
            e);
      } else {
        log.error(
            "Failed to trigger country refresh on attempt {}/{}: {}",
            attemptNumber,
            maxAttempts,
            e.getMessage(),
            e);
      }

      recordFailure(sample, attemptNumber, e);

      if (attemptNumber < maxAttempts) {
        scheduleRetry(attemptNumber + 1);
      } else {
        log.error("All retry attempts exhausted for country refresh");
        recordExhausted();
      }
    }
  }

  private void scheduleRetry(int attemptNumber) {
    var delayMinutes = properties.getRefresh().getRetry().getDelayMinutes();
    var retryTime = Instant.now().plus(Duration.ofMinutes(delayMinutes));

    log.info(
        "Scheduling retry attempt {} in {} minutes at {}", attemptNumber, delayMinutes, retryTime);

    meterRegistry
        .counter(
            "country.refresh.trigger.retry.scheduled", "attempt", String.valueOf(attemptNumber))
        .increment();

    taskScheduler.schedule(
        () -> {
          log.info("Executing retry attempt {} (scheduled retry)", attemptNumber);
          triggerRefresh(attemptNumber);
        },
        retryTime);
  }

  private void recordSuccess(Timer.Sample sample, int attemptNumber) {
    sample.stop(
        Timer.builder("country.refresh.trigger.duration")
            .tag("status", "success")
            .tag("attempt", String.valueOf(attemptNumber))
            .register(meterRegistry));

    meterRegistry
        .counter(
            "country.refresh.trigger.executions",
            "status",
            "success",
            "attempt",
            String.valueOf(attemptNumber))
        .increment();
  }

  private void recordFailure(Timer.Sample sample, int attemptNumber, Exception e) {
    sample.stop(
        Timer.builder("country.refresh.trigger.duration")
            .tag("status", "failure")
            .tag("attempt", String.valueOf(attemptNumber))
            .tag("error", e.getClass().getSimpleName())
            .register(meterRegistry));

    meterRegistry
        .counter(
            "country.refresh.trigger.executions",
            "status",
            "failure",
            "attempt",
            String.valueOf(attemptNumber),
            "error",
            e.getClass().getSimpleName())
        .increment();
  }

  private void recordExhausted() {
    meterRegistry.counter("country.refresh.trigger.exhausted").increment();
  }
}
