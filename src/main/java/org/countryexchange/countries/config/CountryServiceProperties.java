package org.countryexchange.countries.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "country-service")
@Validated
public class CountryServiceProperties {

  @Valid private Refresh refresh = new Refresh();
  @Valid private Sources sources = new Sources();
  @Valid private Report report = new Report();

  public Refresh getRefresh() {
    return refresh;
  }

  public void setRefresh(Refresh refresh) {
    this.refresh = refresh;
  }

  public Sources getSources() {
    return sources;
  }

  public void setSources(Sources sources) {
    this.sources = sources;
  }

  public Report getReport() {
    return report;
  }

  public void setReport(Report report) {
    this.report = report;
  }

  public static class Refresh {

    /** Cron expression for the scheduled refresh job. */
    private String cron = "0 0 2 * * ?";

    /** Whether to run a refresh on application startup if no countries are stored. */
    private boolean refreshOnStartup = true;

    /** Number of countries written per upsert statement. */
    @Min(1)
    @Max(1000)
    private int batchSize = 100;

    @Valid private Retry retry = new Retry();
    @Valid private Executor executor = new Executor();

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public boolean isRefreshOnStartup() {
      return refreshOnStartup;
    }

    public void setRefreshOnStartup(boolean refreshOnStartup) {
      this.refreshOnStartup = refreshOnStartup;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }

    public Executor getExecutor() {
      return executor;
    }

    public void setExecutor(Executor executor) {
      this.executor = executor;
    }
  }

  public static class Retry {
    /**
     * Maximum number of attempts for a scheduled refresh whose precheck fails (including the
     * initial attempt).
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Delay between retries in minutes. */
    @Min(1)
    @Max(60)
    private long delayMinutes = 5;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayMinutes() {
      return delayMinutes;
    }

    public void setDelayMinutes(long delayMinutes) {
      this.delayMinutes = delayMinutes;
    }
  }

  /** Pool that runs detached refresh cycles. */
  public static class Executor {
    @Min(1)
    private int corePoolSize = 2;

    @Min(1)
    private int maxPoolSize = 4;

    /** Cycles waiting for a worker; triggers beyond this are rejected. */
    @Min(0)
    private int queueCapacity = 10;

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }

  public static class Sources {
    @Valid
    private Source countries =
        new Source(
            "https://restcountries.com/v2/all"
                + "?fields=name,capital,region,population,flag,currencies,independent");

    @Valid private Source exchangeRates = new Source("https://open.er-api.com/v6/latest/USD");

    public Source getCountries() {
      return countries;
    }

    public void setCountries(Source countries) {
      this.countries = countries;
    }

    public Source getExchangeRates() {
      return exchangeRates;
    }

    public void setExchangeRates(Source exchangeRates) {
      this.exchangeRates = exchangeRates;
    }
  }

  public static class Source {
    /** Full URL fetched with GET. */
    @NotBlank private String url;

    /** Timeout in seconds for one fetch. */
    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    public Source() {}

    public Source(String url) {
      this.url = url;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  public static class Report {
    /** Where the summary PNG is written. Not replaced atomically. */
    @NotBlank private String path = "cache/summary.png";

    /** Number of countries listed on the summary. */
    @Min(1)
    @Max(5)
    private int topCount = 5;

    /** Whether to draw flag thumbnails next to listed countries. */
    private boolean flagsEnabled = true;

    @Min(1)
    @Max(60)
    private int flagTimeoutSeconds = 10;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getTopCount() {
      return topCount;
    }

    public void setTopCount(int topCount) {
      this.topCount = topCount;
    }

    public boolean isFlagsEnabled() {
      return flagsEnabled;
    }

    public void setFlagsEnabled(boolean flagsEnabled) {
      this.flagsEnabled = flagsEnabled;
    }

    public int getFlagTimeoutSeconds() {
      return flagTimeoutSeconds;
    }

    public void setFlagTimeoutSeconds(int flagTimeoutSeconds) {
      this.flagTimeoutSeconds = flagTimeoutSeconds;
    }
  }
}
