package org.countryexchange.countries.service;

/** Error codes for country service exceptions. */
public enum CountryServiceError {
  /** An upstream data source could not be fetched. */
  SOURCE_UNAVAILABLE,

  /** No country matches the requested name. */
  COUNTRY_NOT_FOUND,

  /** Sort parameter is not one of the supported values. */
  INVALID_SORT,

  /** The summary image has not been generated yet. */
  SUMMARY_IMAGE_NOT_FOUND,

  /** The refresh worker pool is saturated. */
  REFRESH_REJECTED,
}
