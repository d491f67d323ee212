package org.countryexchange.countries.api;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.countryexchange.countries.service.exception.InvalidRequestException;
import org.countryexchange.countries.service.exception.RefreshRejectedException;
import org.countryexchange.countries.service.exception.ResourceNotFoundException;
import org.countryexchange.countries.service.exception.ServiceException;
import org.countryexchange.countries.service.exception.SourceUnavailableException;

/** Maps service exceptions to {@link ApiErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String SOURCE_UNAVAILABLE_MESSAGE = "External data source unavailable";

  @ExceptionHandler(SourceUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleSourceUnavailable(
      SourceUnavailableException ex, HttpServletRequest request) {
    logException(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        new ApiErrorResponse(
            ApiErrorType.SERVICE_UNAVAILABLE,
            SOURCE_UNAVAILABLE_MESSAGE,
            ex.getSource().name(),
            ex.getMessage()));
  }

  @ExceptionHandler(RefreshRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleRefreshRejected(
      RefreshRejectedException ex, HttpServletRequest request) {
    logException(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    return build(HttpStatus.SERVICE_UNAVAILABLE, toBody(ApiErrorType.SERVICE_UNAVAILABLE, ex));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(
      ResourceNotFoundException ex, HttpServletRequest request) {
    logException(HttpStatus.NOT_FOUND, ex, request);
    return build(HttpStatus.NOT_FOUND, toBody(ApiErrorType.NOT_FOUND, ex));
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return build(HttpStatus.BAD_REQUEST, toBody(ApiErrorType.INVALID_REQUEST, ex));
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadParameter(
      Exception ex, HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return build(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, ex.getMessage()));
  }

  @ExceptionHandler(ServiceException.class)
  public ResponseEntity<ApiErrorResponse> handleServiceException(
      ServiceException ex, HttpServletRequest request) {
    logException(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, toBody(ApiErrorType.INTERNAL_ERROR, ex));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    logException(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiErrorResponse.of(ApiErrorType.INTERNAL_ERROR, "Internal server error"));
  }

  private static ApiErrorResponse toBody(ApiErrorType type, ServiceException ex) {
    var code = ex.getCode() == null ? null : ex.getCode().name();
    return new ApiErrorResponse(type, ex.getMessage(), code, null);
  }

  // error bodies are JSON even on endpoints that produce images
  private static ResponseEntity<ApiErrorResponse> build(HttpStatus status, ApiErrorResponse body) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    if (status.is5xxServerError()) {
      log.error(
          "Request {} {} failed with status {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          status.value(),
          ex.getMessage(),
          ex);
    } else {
      log.warn(
          "Request {} {} failed with status {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          status.value(),
          ex.getMessage());
    }
  }
}
