package org.countryexchange.countries.service.exception;

import org.countryexchange.countries.client.SourceName;
import org.countryexchange.countries.service.CountryServiceError;

/**
 * Thrown when an upstream source cannot be fetched: transport error, timeout, non-success status or
 * an undecodable body.
 */
public class SourceUnavailableException extends ServiceException {

  private final SourceName source;

  public SourceUnavailableException(SourceName source, String message) {
    this(source, message, null);
  }

  public SourceUnavailableException(SourceName source, String message, Throwable cause) {
    super(message, CountryServiceError.SOURCE_UNAVAILABLE, cause);
    this.source = source;
  }

  public SourceName getSource() {
    return source;
  }
}
