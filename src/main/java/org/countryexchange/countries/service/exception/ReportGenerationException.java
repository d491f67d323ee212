package org.countryexchange.countries.service.exception;

/** Thrown when the summary image cannot be rendered or written. */
public class ReportGenerationException extends ServiceException {

  public ReportGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
