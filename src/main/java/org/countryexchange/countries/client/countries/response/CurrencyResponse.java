package org.countryexchange.countries.client.countries.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Currency descriptor as listed by the country directory; any field may be absent. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrencyResponse(String code, String name, String symbol) {}
