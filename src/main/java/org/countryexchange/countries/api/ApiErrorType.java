package org.countryexchange.countries.api;

/** Categories of error returned by the API. */
public enum ApiErrorType {
  INVALID_REQUEST,
  NOT_FOUND,
  SERVICE_UNAVAILABLE,
  INTERNAL_ERROR
}
