package org.countryexchange.countries.service.exception;

import org.countryexchange.countries.service.CountryServiceError;

public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message, CountryServiceError code) {
    super(message, code);
  }
}
