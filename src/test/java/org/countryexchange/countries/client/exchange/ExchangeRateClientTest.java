package org.countryexchange.countries.client.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import org.countryexchange.countries.client.SourceName;
import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.fixture.SourceStubs;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/** Tests for {@link ExchangeRateClient} against a local WireMock server. */
@DisplayName("ExchangeRateClient Tests")
class ExchangeRateClientTest {

  private WireMockServer wireMockServer;

  private ExchangeRateClient client;

  @BeforeEach
  void setUp() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();

    var properties = new CountryServiceProperties();
    properties
        .getSources()
        .getExchangeRates()
        .setUrl(wireMockServer.baseUrl() + SourceStubs.RATES_PATH);
    properties.getSources().getExchangeRates().setTimeoutSeconds(1);

    client = new ExchangeRateClient(WebClient.builder(), properties);
  }

  @AfterEach
  void tearDown() {
    wireMockServer.stop();
  }

  @Test
  @DisplayName("fetchLatest - with valid payload - maps base and rates")
  void fetchLatest_WithValidPayload_MapsRates() {
    SourceStubs.stubRates(wireMockServer, SourceStubs.RATES_JSON);

    var result = client.fetchLatest();

    assertThat(result.baseCode()).isEqualTo("USD");
    assertThat(result.rates()).hasSize(3);
    assertThat(result.rates().get("NGN")).isEqualByComparingTo(new BigDecimal("1600"));
    assertThat(result.rates().get("GHS")).isEqualByComparingTo(new BigDecimal("15.3"));
  }

  @Test
  @DisplayName("fetchLatest - when source returns 503 - throws with status in message")
  void fetchLatest_WhenServerError_ThrowsSourceUnavailable() {
    SourceStubs.stubStatus(wireMockServer, SourceStubs.RATES_PATH, 503);

    assertThatThrownBy(() -> client.fetchLatest())
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("exchange rates")
        .hasMessageContaining("HTTP 503")
        .extracting("source")
        .isEqualTo(SourceName.EXCHANGE_RATES);
  }

  @Test
  @DisplayName("fetchLatest - when rates are missing - throws SourceUnavailableException")
  void fetchLatest_WhenRatesMissing_ThrowsSourceUnavailable() {
    SourceStubs.stubRates(wireMockServer, "{\"result\": \"error\"}");

    assertThatThrownBy(() -> client.fetchLatest())
        .isInstanceOf(SourceUnavailableException.class)
        .extracting("source")
        .isEqualTo(SourceName.EXCHANGE_RATES);
  }

  @Test
  @DisplayName("fetchLatest - when body is not JSON - throws SourceUnavailableException")
  void fetchLatest_WhenMalformedBody_ThrowsSourceUnavailable() {
    SourceStubs.stubRates(wireMockServer, "<html>maintenance</html>");

    assertThatThrownBy(() -> client.fetchLatest())
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("exchange rates");
  }
}
