package org.gridiron.service;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.gridiron.lineup.EnrichmentFeed;
import org.gridiron.lineup.ExternalProjection;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Builds the "sleeper" enrichment feed from Sleeper's public API: weekly projections and
 * trending adds, fetched in parallel and joined on Sleeper's player id.
 */
public class SleeperService implements FeedSource {

    private static final Logger log = LoggerFactory.getLogger(SleeperService.class);

    public static final String BASE_URL = "https://api.sleeper.app";
    public static final String FEED_NAME = "sleeper";

    private static final List<String> POSITIONS = List.of("QB", "RB", "WR", "TE", "K", "DEF");
    private static final int TRENDING_LOOKBACK_HOURS = 24;
    private static final int TRENDING_LIMIT = 300;

    // Share of the projection a player can plausibly miss or beat it by.
    private static final Map<String, Double> VOLATILITY = Map.of(
            "QB", 0.25,
            "RB", 0.40,
            "WR", 0.45,
            "TE", 0.50,
            "K", 0.35,
            "DEF", 0.50
    );
    private static final double DEFAULT_VOLATILITY = 0.40;

    private final OkHttpClient client;
    private final String baseUrl;
    private final String scoringKey;
    private final int season;
    private final ExecutorService executor;

    public SleeperService(String scoringKey, int season, ExecutorService executor) {
        this(BASE_URL, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build(), scoringKey, season, executor);
    }

    public SleeperService(String baseUrl, OkHttpClient client, String scoringKey, int season, ExecutorService executor) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = client;
        this.scoringKey = scoringKey;
        this.season = season;
        this.executor = executor;
    }

    @Override
    public String name() {
        return FEED_NAME;
    }

    @Override
    public EnrichmentFeed fetchFeed(Integer week) throws IOException {
        try {
            return fetchFeedAsync(week, executor).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof IOException io) throw io;
            throw e;
        }
    }

    @Override
    public CompletableFuture<EnrichmentFeed> fetchFeedAsync(Integer week, Executor executor) {
        CompletableFuture<Integer> resolvedWeek = week != null
                ? CompletableFuture.completedFuture(week)
                : CompletableFuture.supplyAsync(() -> unchecked(this::currentWeek), executor);

        CompletableFuture<JSONArray> projections = resolvedWeek.thenApplyAsync(
                w -> unchecked(() -> fetchProjections(w)), executor);
        CompletableFuture<Map<String, Integer>> trending = CompletableFuture.supplyAsync(
                () -> unchecked(this::fetchTrending), executor)
                .exceptionally(e -> {
                    log.warn("Sleeper trending unavailable: {}", rootMessage(e));
                    return Map.of();
                });

        return projections.thenCombine(trending, this::buildFeed);
    }

    // --- REQUESTS ---

    int currentWeek() throws IOException {
        JSONObject state;
        try {
            state = new JSONObject(get(baseUrl + "/v1/state/nfl"));
        } catch (JSONException e) {
            throw new IOException("Sleeper state is not a JSON object", e);
        }
        int week = state.optInt("week", 0);
        if (week < 1) week = state.optInt("display_week", 1);
        return Math.max(1, week);
    }

    JSONArray fetchProjections(int week) throws IOException {
        HttpUrl.Builder url = HttpUrl.get(baseUrl + "/projections/nfl/" + season + "/" + week).newBuilder()
                .addQueryParameter("season_type", "regular");
        for (String position : POSITIONS) {
            url.addQueryParameter("position[]", position);
        }
        try {
            return new JSONArray(get(url.build().toString()));
        } catch (JSONException e) {
            throw new IOException("Sleeper projections are not a JSON array", e);
        }
    }

    Map<String, Integer> fetchTrending() throws IOException {
        HttpUrl url = HttpUrl.get(baseUrl + "/v1/players/nfl/trending/add").newBuilder()
                .addQueryParameter("lookback_hours", String.valueOf(TRENDING_LOOKBACK_HOURS))
                .addQueryParameter("limit", String.valueOf(TRENDING_LIMIT))
                .build();
        JSONArray array;
        try {
            array = new JSONArray(get(url.toString()));
        } catch (JSONException e) {
            throw new IOException("Sleeper trending is not a JSON array", e);
        }
        Map<String, Integer> adds = new HashMap<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject row = array.optJSONObject(i);
            if (row == null) continue;
            String id = row.optString("player_id", null);
            if (id != null) adds.merge(id, Math.max(0, row.optInt("count", 0)), Integer::sum);
        }
        return adds;
    }

    private String get(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Sleeper API error " + response.code() + " on " + url);
            }
            return text;
        }
    }

    // --- FEED ASSEMBLY ---

    EnrichmentFeed buildFeed(JSONArray projections, Map<String, Integer> trending) {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < projections.length(); i++) {
            Row row = toRow(projections.optJSONObject(i));
            if (row != null) rows.add(row);
        }

        List<MatchupRater.ProjectionRow> ratingInput = new ArrayList<>();
        for (Row row : rows) {
            if (row.points() != null) ratingInput.add(new MatchupRater.ProjectionRow(row.position(), row.opponent(), row.points()));
        }
        MatchupRater rater = new MatchupRater(ratingInput);

        List<ExternalProjection> entries = new ArrayList<>();
        for (Row row : rows) {
            Double floor = null;
            Double ceiling = null;
            if (row.points() != null) {
                double volatility = VOLATILITY.getOrDefault(row.position(), DEFAULT_VOLATILITY);
                floor = round1(row.points() * (1.0 - volatility));
                ceiling = round1(row.points() * (1.0 + volatility));
            }
            MatchupRater.Rating rating = rater.rate(row.position(), row.opponent());
            entries.add(new ExternalProjection(
                    row.name(), row.team(), row.points(), floor, ceiling,
                    trending.get(row.playerId()),
                    row.opponent(),
                    rating == null ? null : rating.score(),
                    rating == null ? null : rating.description()));
        }
        log.debug("Sleeper feed built with {} projections, {} trending ids", entries.size(), trending.size());
        return new EnrichmentFeed(FEED_NAME, entries);
    }

    private record Row(String playerId, String name, String team, String position, String opponent, Double points) {}

    private Row toRow(JSONObject projection) {
        if (projection == null) return null;
        JSONObject player = projection.optJSONObject("player");
        if (player == null) return null;

        String position = upper(player.optString("position", null));
        String team = upper(projection.optString("team", player.optString("team", null)));
        String first = player.optString("first_name", "").trim();
        String last = player.optString("last_name", "").trim();
        // Yahoo names defenses by city only ("Kansas City"), Sleeper splits city and nickname.
        String name = "DEF".equals(position) ? first : (first + " " + last).trim();
        if (name.isEmpty() || position == null) return null;

        JSONObject stats = projection.optJSONObject("stats");
        Double points = null;
        if (stats != null && stats.has(scoringKey)) {
            double value = stats.optDouble(scoringKey, Double.NaN);
            if (Double.isFinite(value)) points = value;
        }
        return new Row(projection.optString("player_id", null), name, team, position,
                upper(projection.optString("opponent", null)), points);
    }

    // --- HELPERS ---

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

    private static String upper(String s) {
        return s == null || s.isBlank() ? null : s.trim().toUpperCase(Locale.ROOT);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
