package org.countryexchange.countries.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.countryexchange.countries.api.response.StatusResponse;
import org.countryexchange.countries.service.CountryService;

@Tag(name = "Status Handler", description = "Refresh progress as seen from stored data")
@RestController
@RequestMapping(path = "/v1/status")
public class StatusController {

  private static final Logger log = LoggerFactory.getLogger(StatusController.class);

  private final CountryService countryService;

  public StatusController(CountryService countryService) {
    this.countryService = countryService;
  }

  @Operation(
      summary = "Get status",
      description = "Stored country count and the newest refresh timestamp")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StatusResponse.class)))
      })
  @GetMapping(produces = "application/json")
  public StatusResponse getStatus() {
    log.debug("Getting status");

    return StatusResponse.from(countryService.getStatus());
  }
}
