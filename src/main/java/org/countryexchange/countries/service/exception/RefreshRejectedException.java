package org.countryexchange.countries.service.exception;

import org.countryexchange.countries.service.CountryServiceError;

/** Thrown when the refresh worker pool cannot accept another cycle. */
public class RefreshRejectedException extends ServiceException {

  public RefreshRejectedException(String message, Throwable cause) {
    super(message, CountryServiceError.REFRESH_REJECTED, cause);
  }
}
