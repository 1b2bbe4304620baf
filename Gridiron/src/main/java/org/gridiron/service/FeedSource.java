package org.gridiron.service;

import org.gridiron.lineup.EnrichmentFeed;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * A secondary projection source. Implementations may fail; callers degrade to an empty feed.
 */
public interface FeedSource {

    String name();

    /** @param week NFL week, or null for the current one */
    EnrichmentFeed fetchFeed(Integer week) throws IOException;

    /**
     * Non-blocking variant for callers that already run on {@code executor}. Implementations that
     * fan out must compose their stages rather than join on a pool thread.
     */
    default CompletableFuture<EnrichmentFeed> fetchFeedAsync(Integer week, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetchFeed(week);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
