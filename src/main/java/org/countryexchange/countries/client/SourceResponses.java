package org.countryexchange.countries.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.ClientResponse;

import reactor.core.publisher.Mono;

import org.countryexchange.countries.service.exception.SourceUnavailableException;

/** Error translation shared by the upstream clients. */
public final class SourceResponses {

  private static final Logger log = LoggerFactory.getLogger(SourceResponses.class);

  public static final String USER_AGENT = "CountryExchangeServiceClient/1.0";

  private static final int MAX_BODY_LENGTH = 500;

  private SourceResponses() {}

  /**
   * Maps an error status to a {@link SourceUnavailableException} carrying a truncated body.
   *
   * @param source the upstream that answered
   * @param response the error response
   * @return mono emitting the exception
   */
  public static Mono<? extends Throwable> toException(SourceName source, ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(
            body -> {
              var message = body;
              if (message.length() > MAX_BODY_LENGTH) {
                message = message.substring(0, MAX_BODY_LENGTH) + "... (truncated)";
              }

              log.warn(
                  "{} source error: HTTP {} - {}",
                  source.getDescription(),
                  response.statusCode(),
                  message);

              return new SourceUnavailableException(
                  source,
                  "Could not fetch data from "
                      + source.getDescription()
                      + " source: HTTP "
                      + response.statusCode().value());
            });
  }

  /**
   * Wraps transport, timeout and decode failures.
   *
   * @param source the upstream being called
   * @param e the failure
   * @return exception to throw
   */
  public static SourceUnavailableException unexpected(SourceName source, Exception e) {
    log.warn("Unexpected error fetching {} data: {}", source.getDescription(), e.getMessage(), e);
    return new SourceUnavailableException(
        source, "Could not fetch data from " + source.getDescription() + " source", e);
  }
}
