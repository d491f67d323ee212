package org.countryexchange.countries.service.dto;

import java.time.Instant;

/**
 * Result of a completed detached refresh cycle.
 *
 * @param cycleTimestamp timestamp stamped on every row written by the cycle
 * @param enrichedCount number of countries produced by enrichment
 * @param affectedRows rows reported by the database across all chunks; may exceed the number of
 *     distinct countries
 * @param reportGenerated whether the summary image was written
 */
public record RefreshOutcome(
    Instant cycleTimestamp, int enrichedCount, int affectedRows, boolean reportGenerated) {}
