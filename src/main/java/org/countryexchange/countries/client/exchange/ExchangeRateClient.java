package org.countryexchange.countries.client.exchange;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.countryexchange.countries.client.SourceName;
import org.countryexchange.countries.client.SourceResponses;
import org.countryexchange.countries.client.exchange.response.ExchangeRateResponse;
import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/** Fetches the latest exchange-rate snapshot. No retries. */
@Component
public class ExchangeRateClient {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateClient.class);

  private final WebClient webClient;
  private final String url;
  private final Duration timeout;

  public ExchangeRateClient(
      WebClient.Builder webClientBuilder, CountryServiceProperties properties) {
    var config = properties.getSources().getExchangeRates();

    this.url = config.getUrl();
    this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
    this.webClient =
        webClientBuilder.clone().defaultHeader("User-Agent", SourceResponses.USER_AGENT).build();

    log.info("ExchangeRateClient initialized with URL: {}", url);
  }

  /**
   * Fetches the current rate table.
   *
   * @return decoded response with a non-null rates map
   * @throws SourceUnavailableException on transport error, timeout, non-2xx status, an undecodable
   *     body or a body without rates
   */
  public ExchangeRateResponse fetchLatest() {
    log.info("Requesting exchange rates: {}", url);

    try {
      var response =
          webClient
              .get()
              .uri(url)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  r -> SourceResponses.toException(SourceName.EXCHANGE_RATES, r))
              .bodyToMono(ExchangeRateResponse.class)
              .timeout(timeout)
              .block();

      if (response == null || response.rates() == null) {
        throw new SourceUnavailableException(
            SourceName.EXCHANGE_RATES, "Exchange rate response did not contain rates");
      }

      log.debug("Fetched {} exchange rates", response.rates().size());
      return response;
    } catch (SourceUnavailableException sue) {
      throw sue;
    } catch (Exception e) {
      throw SourceResponses.unexpected(SourceName.EXCHANGE_RATES, e);
    }
  }
}
