package org.countryexchange.countries.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.service.CountryRefreshService;

/**
 * Logs the effective configuration and, when enabled, starts one refresh if no countries are
 * stored yet. A failed startup refresh is logged and the application keeps running; the scheduled
 * refresh or a manual trigger can populate the data later.
 */
@Component
public class CountryServiceStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(CountryServiceStartupConfig.class);

  private final CountryServiceProperties properties;
  private final CountryRepository countryRepository;
  private final CountryRefreshService countryRefreshService;

  public CountryServiceStartupConfig(
      CountryServiceProperties properties,
      CountryRepository countryRepository,
      CountryRefreshService countryRefreshService) {
    this.properties = properties;
    this.countryRepository = countryRepository;
    this.countryRefreshService = countryRefreshService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();
    refreshIfNeeded();
  }

  private void refreshIfNeeded() {
    if (!properties.getRefresh().isRefreshOnStartup()) {
      log.info("Startup refresh is disabled");
      return;
    }

    var stored = countryRepository.count();
    if (stored > 0) {
      log.info("Skipping startup refresh, {} countries already stored", stored);
      return;
    }

    try {
      var ticket = countryRefreshService.refresh();
      log.info("Startup refresh dispatched as cycle {}", ticket.cycleTimestamp());
    } catch (Exception e) {
      log.error("Startup refresh failed, countries stay empty until the next refresh", e);
    }
  }

  private void logConfiguration() {
    var refresh = properties.getRefresh();
    var sources = properties.getSources();
    var report = properties.getReport();

    log.info(
        "Country Service Configuration: refresh[cron={}, onStartup={}, batchSize={},"
            + " retry={}x{}m, executor={}/{}/{}] sources[countries={} ({}s), exchangeRates={}"
            + " ({}s)] report[path={}, top={}, flags={}]",
        refresh.getCron(),
        refresh.isRefreshOnStartup(),
        refresh.getBatchSize(),
        refresh.getRetry().getMaxAttempts(),
        refresh.getRetry().getDelayMinutes(),
        refresh.getExecutor().getCorePoolSize(),
        refresh.getExecutor().getMaxPoolSize(),
        refresh.getExecutor().getQueueCapacity(),
        sources.getCountries().getUrl(),
        sources.getCountries().getTimeoutSeconds(),
        sources.getExchangeRates().getUrl(),
        sources.getExchangeRates().getTimeoutSeconds(),
        report.getPath(),
        report.getTopCount(),
        report.isFlagsEnabled());
  }
}
