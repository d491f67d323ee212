package org.countryexchange.countries.client.exchange.response;

import java.math.BigDecimal;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Exchange-rate snapshot: units of each currency per base currency. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeRateResponse(
    String result, @JsonProperty("base_code") String baseCode, Map<String, BigDecimal> rates) {}
