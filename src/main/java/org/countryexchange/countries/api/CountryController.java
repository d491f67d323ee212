package org.countryexchange.countries.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.countryexchange.countries.api.response.CountryResponse;
import org.countryexchange.countries.api.response.RefreshResponse;
import org.countryexchange.countries.report.SummaryImageGenerator;
import org.countryexchange.countries.service.CountryRefreshService;
import org.countryexchange.countries.service.CountryService;
import org.countryexchange.countries.service.CountryServiceError;
import org.countryexchange.countries.service.CountrySort;
import org.countryexchange.countries.service.exception.ResourceNotFoundException;

@Tag(name = "Countries Handler", description = "Endpoints for querying and refreshing countries")
@RestController
@RequestMapping(path = "/v1/countries")
public class CountryController {

  private static final Logger log = LoggerFactory.getLogger(CountryController.class);

  private final CountryService countryService;
  private final CountryRefreshService countryRefreshService;
  private final SummaryImageGenerator summaryImageGenerator;

  public CountryController(
      CountryService countryService,
      CountryRefreshService countryRefreshService,
      SummaryImageGenerator summaryImageGenerator) {
    this.countryService = countryService;
    this.countryRefreshService = countryRefreshService;
    this.summaryImageGenerator = summaryImageGenerator;
  }

  @Operation(
      summary = "Refresh countries",
      description =
          "Fetches both upstream sources synchronously, then enriches, stores and summarizes the"
              + " data in the background. Completion is observable through /v1/status.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "202",
            description = "Refresh started in background",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RefreshResponse.class))),
        @ApiResponse(
            responseCode = "503",
            description = "An upstream source is unavailable or too many refreshes are running",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Exchange Rates Unavailable",
                          summary = "Exchange-rate source could not be fetched",
                          value =
                              """
                      {
                        "type": "SERVICE_UNAVAILABLE",
                        "message": "External data source unavailable",
                        "code": "EXCHANGE_RATES",
                        "details": "Could not fetch data from exchange rates source: HTTP 500"
                      }
                      """)
                    }))
      })
  @PostMapping(path = "/refresh", produces = "application/json")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public RefreshResponse refresh() {
    log.info("Refresh requested");

    var ticket = countryRefreshService.refresh();
    return new RefreshResponse("Refresh started in background", ticket.cycleTimestamp());
  }

  @Operation(
      summary = "List countries",
      description =
          "List countries ordered by estimated GDP, optionally filtered by region and currency."
              + " Countries with unknown GDP are always listed last.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(schema = @Schema(implementation = CountryResponse.class)))),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported sort value",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(produces = "application/json")
  public List<CountryResponse> list(
      @Parameter(description = "Region, case-insensitive", example = "Africa")
          @RequestParam(required = false)
          String region,
      @Parameter(description = "Currency code, case-insensitive", example = "NGN")
          @RequestParam(required = false)
          String currency,
      @Parameter(
              description = "GDP ordering: gdp_desc (default) or gdp_asc",
              example = "gdp_desc")
          @RequestParam(required = false)
          String sort) {
    log.info("Listing countries region: {} currency: {} sort: {}", region, currency, sort);

    return countryService.list(region, currency, CountrySort.fromValue(sort)).stream()
        .map(CountryResponse::from)
        .toList();
  }

  @Operation(
      summary = "Get the summary image",
      description =
          "Returns the PNG summary written after the last refresh. The file is overwritten in"
              + " place, so a request made while a refresh is writing it may get a partial image.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "image/png",
                    schema = @Schema(type = "string", format = "binary"))),
        @ApiResponse(
            responseCode = "404",
            description = "Summary image not generated yet",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/image")
  public ResponseEntity<byte[]> image() {
    log.info("Getting summary image");

    var image =
        summaryImageGenerator
            .readLatest()
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "Summary image not found", CountryServiceError.SUMMARY_IMAGE_NOT_FOUND));
    return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(image);
  }

  @Operation(summary = "Get country by name", description = "Name matching is case-insensitive")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CountryResponse.class))),
        @ApiResponse(
            responseCode = "404",
            description = "Country not found",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/{name}", produces = "application/json")
  public CountryResponse getByName(@PathVariable String name) {
    log.info("Getting country: {}", name);

    return CountryResponse.from(countryService.getByName(name));
  }

  @Operation(
      summary = "Delete country by name",
      description = "Name matching is case-insensitive")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Country deleted"),
        @ApiResponse(
            responseCode = "404",
            description = "Country not found",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @DeleteMapping(path = "/{name}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteByName(@PathVariable String name) {
    log.info("Deleting country: {}", name);

    countryService.deleteByName(name);
  }
}
