package org.countryexchange.countries.service.exception;

import org.countryexchange.countries.service.CountryServiceError;

public class ResourceNotFoundException extends ServiceException {

  public ResourceNotFoundException(String message, CountryServiceError code) {
    super(message, code);
  }
}
