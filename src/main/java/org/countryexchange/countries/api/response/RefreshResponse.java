package org.countryexchange.countries.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement of a refresh accepted for background processing")
public record RefreshResponse(
    @Schema(
            description = "Status message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Refresh started in background")
        String message,
    @Schema(
            description = "Timestamp the refresh cycle stamps on every country it writes",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-22T18:00:00.123Z")
        Instant cycleTimestamp) {}
