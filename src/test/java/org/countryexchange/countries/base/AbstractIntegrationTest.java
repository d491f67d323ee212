package org.countryexchange.countries.base;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.github.tomakehurst.wiremock.WireMockServer;

import org.countryexchange.countries.config.TestContainersConfig;
import org.countryexchange.countries.config.WireMockConfig;
import org.countryexchange.countries.fixture.SourceStubs;

/**
 * Base class for full-context tests.
 *
 * <p>Provides:
 *
 * <ul>
 *   <li>PostgreSQL container with Flyway migrations
 *   <li>WireMock server in place of both upstream sources
 *   <li>MockMvc for HTTP assertions
 * </ul>
 *
 * <p>The {@code test} profile disables caching, the scheduled trigger, the startup refresh and flag
 * downloads. Tables are emptied and stubs reset before each test. Skipped when Docker is not
 * available.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import({TestContainersConfig.class, WireMockConfig.class})
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

  @Autowired protected MockMvc mockMvc;

  @Autowired protected WireMockServer wireMockServer;

  @Autowired protected JdbcTemplate jdbcTemplate;

  @DynamicPropertySource
  static void configureSourceUrls(DynamicPropertyRegistry registry) {
    var wireMock = WireMockConfig.getWireMockServer();
    registry.add(
        "country-service.sources.countries.url",
        () -> wireMock.baseUrl() + SourceStubs.COUNTRIES_PATH);
    registry.add(
        "country-service.sources.exchange-rates.url",
        () -> wireMock.baseUrl() + SourceStubs.RATES_PATH);
  }

  @BeforeEach
  protected void resetDatabaseAndWireMock() {
    jdbcTemplate.update("DELETE FROM countries");
    wireMockServer.resetAll();
  }
}
