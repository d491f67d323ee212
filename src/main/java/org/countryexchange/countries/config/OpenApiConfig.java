package org.countryexchange.countries.config;

import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.responses.ApiResponse;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Country Exchange Service",
            version = "1.0",
            description =
                "Country metadata enriched with exchange rates and an estimated GDP, refreshed"
                    + " from upstream sources",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {@Server(url = "http://localhost:8080", description = "Local environment")})
public class OpenApiConfig {

  /** Adds the generic 500 response to every operation that does not declare one. */
  @Bean
  public OpenApiCustomizer standardErrorResponsesCustomizer() {
    return openApi -> {
      if (openApi.getPaths() == null) {
        return;
      }

      openApi
          .getPaths()
          .values()
          .forEach(
              pathItem ->
                  pathItem
                      .readOperations()
                      .forEach(
                          operation -> {
                            var responses = operation.getResponses();
                            if (responses != null && !responses.containsKey("500")) {
                              responses.addApiResponse(
                                  "500", new ApiResponse().description("Internal server error"));
                            }
                          }));
    };
  }
}
