package org.countryexchange.countries.client.countries;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.countryexchange.countries.client.SourceName;
import org.countryexchange.countries.client.SourceResponses;
import org.countryexchange.countries.client.countries.response.CountryResponse;
import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/** Fetches the full country list from the country directory. No retries. */
@Component
public class RestCountriesClient {

  private static final Logger log = LoggerFactory.getLogger(RestCountriesClient.class);

  private static final ParameterizedTypeReference<List<CountryResponse>> COUNTRY_LIST =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final String url;
  private final Duration timeout;

  public RestCountriesClient(
      WebClient.Builder webClientBuilder, CountryServiceProperties properties) {
    var config = properties.getSources().getCountries();

    this.url = config.getUrl();
    this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
    this.webClient =
        webClientBuilder.clone().defaultHeader("User-Agent", SourceResponses.USER_AGENT).build();

    log.info("RestCountriesClient initialized with URL: {}", url);
  }

  /**
   * Fetches every country listed by the directory.
   *
   * @return countries in source order, never null
   * @throws SourceUnavailableException on transport error, timeout, non-2xx status or a body that
   *     cannot be decoded
   */
  public List<CountryResponse> fetchAll() {
    log.info("Requesting country directory: {}", url);

    try {
      var response =
          webClient
              .get()
              .uri(url)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  r -> SourceResponses.toException(SourceName.COUNTRIES, r))
              .bodyToMono(COUNTRY_LIST)
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new SourceUnavailableException(
            SourceName.COUNTRIES, "Received empty response from country directory");
      }

      log.debug("Fetched {} countries from country directory", response.size());
      return response;
    } catch (SourceUnavailableException sue) {
      throw sue;
    } catch (Exception e) {
      throw SourceResponses.unexpected(SourceName.COUNTRIES, e);
    }
  }
}
