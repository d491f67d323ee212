package org.countryexchange.countries.service.dto;

import java.time.Instant;

/**
 * Aggregate state of the country table.
 *
 * @param totalCountries stored row count
 * @param lastRefreshedAt newest refresh timestamp, null when nothing is stored
 */
public record CountryStatus(long totalCountries, Instant lastRefreshedAt) {}
