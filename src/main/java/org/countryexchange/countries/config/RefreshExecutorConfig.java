package org.countryexchange.countries.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for detached refresh cycles.
 *
 * <p>Each triggered refresh occupies one worker from enrichment to report generation. Overlapping
 * triggers run side by side; once the workers and the queue are full further triggers are rejected
 * and surface to the caller as a refresh rejection.
 */
@Configuration
public class RefreshExecutorConfig {

  public static final String COUNTRY_REFRESH_EXECUTOR = "countryRefreshExecutor";

  @Bean(name = COUNTRY_REFRESH_EXECUTOR)
  public ThreadPoolTaskExecutor countryRefreshExecutor(CountryServiceProperties properties) {
    var config = properties.getRefresh().getExecutor();

    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(config.getCorePoolSize(), config.getMaxPoolSize()));
    executor.setQueueCapacity(config.getQueueCapacity());
    executor.setThreadNamePrefix("country-refresh-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
