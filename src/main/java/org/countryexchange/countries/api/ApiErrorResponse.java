package org.countryexchange.countries.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned by every endpoint. */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(description = "Error category", example = "SERVICE_UNAVAILABLE") ApiErrorType type,
    @Schema(description = "Human readable message", example = "External data source unavailable")
        String message,
    @Schema(description = "Machine readable error code", example = "SOURCE_UNAVAILABLE")
        String code,
    @Schema(
            description = "Additional detail",
            example = "Could not fetch data from exchange rates source")
        String details) {

  public static ApiErrorResponse of(ApiErrorType type, String message) {
    return new ApiErrorResponse(type, message, null, null);
  }
}
