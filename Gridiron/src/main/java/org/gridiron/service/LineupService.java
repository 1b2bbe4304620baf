package org.gridiron.service;

import org.gridiron.lineup.EnrichmentFeed;
import org.gridiron.lineup.LineupOptimizer;
import org.gridiron.lineup.LineupResult;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Gathers roster, league settings and secondary feeds in parallel, then hands them to the
 * {@link LineupOptimizer}.
 *
 * <p>Only the roster is mandatory. A failed settings call means the default template, a failed
 * feed means no enrichment from that source.
 */
public class LineupService {

    private static final Logger log = LoggerFactory.getLogger(LineupService.class);

    private final YahooApi yahoo;
    private final List<FeedSource> feedSources;
    private final LineupOptimizer optimizer;
    private final LineupInsightService insights;
    private final ExecutorService executor;

    public LineupService(YahooApi yahoo, List<FeedSource> feedSources, LineupOptimizer optimizer,
                         LineupInsightService insights, ExecutorService executor) {
        this.yahoo = yahoo;
        this.feedSources = List.copyOf(feedSources);
        this.optimizer = optimizer;
        this.insights = insights;
        this.executor = executor;
    }

    /**
     * @throws IOException when the roster itself cannot be fetched
     */
    public LineupReport build(String leagueKey, String teamKey, Integer week, String strategy, boolean useInsight)
            throws IOException {
        CompletableFuture<JSONObject> roster = CompletableFuture.supplyAsync(
                () -> unchecked(() -> yahoo.getRoster(teamKey, week)), executor);

        CompletableFuture<JSONObject> settings = CompletableFuture.supplyAsync(
                () -> unchecked(() -> yahoo.getLeagueSettings(leagueKey)), executor)
                .exceptionally(e -> {
                    log.warn("Could not fetch roster settings for {}: {}. Using defaults.", leagueKey, rootMessage(e));
                    return new JSONObject();
                });

        List<CompletableFuture<EnrichmentFeed>> feeds = new ArrayList<>();
        for (FeedSource source : feedSources) {
            feeds.add(source.fetchFeedAsync(week, executor)
                    .exceptionally(e -> {
                        log.warn("Feed {} unavailable for {}: {}", source.name(), leagueKey, rootMessage(e));
                        return EnrichmentFeed.empty(source.name());
                    }));
        }

        JSONObject rosterJson;
        try {
            rosterJson = roster.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof IOException io) throw io;
            throw e;
        }
        List<EnrichmentFeed> resolvedFeeds = new ArrayList<>();
        for (CompletableFuture<EnrichmentFeed> feed : feeds) {
            resolvedFeeds.add(feed.join());
        }

        LineupResult result = optimizer.optimize(rosterJson, settings.join(), resolvedFeeds, strategy);

        String insight = null;
        if (useInsight && result.status().isOk()) {
            insight = insights.summarize(result).orElse(null);
        }
        return new LineupReport(leagueKey, teamKey, week, result, insight);
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T call() throws IOException;
    }

    private static <T> T unchecked(IoCall<T> call) {
        try {
            return call.call();
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) cause = cause.getCause();
        return cause.getMessage();
    }
}
