package org.countryexchange.countries.service.dto;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle returned once a refresh cycle has passed its precheck and been queued.
 *
 * @param cycleTimestamp timestamp the cycle will stamp on its rows
 * @param completion completes when the detached work finishes; HTTP and scheduled triggers ignore
 *     it
 */
public record RefreshTicket(Instant cycleTimestamp, CompletableFuture<RefreshOutcome> completion) {}
