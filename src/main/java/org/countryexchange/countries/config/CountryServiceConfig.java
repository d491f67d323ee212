package org.countryexchange.countries.config;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Country Exchange Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties(CountryServiceProperties.class)
public class CountryServiceConfig {

  /** Clock used to stamp refresh cycles. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Unseeded source for the GDP multiplier; tests replace it with a seeded one. */
  @Bean
  public RandomGenerator gdpRandomGenerator() {
    return new Random();
  }
}
