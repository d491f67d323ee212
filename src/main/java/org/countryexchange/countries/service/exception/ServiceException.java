package org.countryexchange.countries.service.exception;

import org.countryexchange.countries.service.CountryServiceError;

/** Base class for all exceptions raised by the country service. */
public class ServiceException extends RuntimeException {

  private final CountryServiceError code;

  public ServiceException(String message) {
    this(message, null, null);
  }

  public ServiceException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public ServiceException(String message, CountryServiceError code) {
    this(message, code, null);
  }

  public ServiceException(String message, CountryServiceError code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * Error code exposed to API clients.
   *
   * @return the code, or null for internal failures without a client-facing code
   */
  public CountryServiceError getCode() {
    return code;
  }
}
