package org.gridiron.service;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.gridiron.auth.YahooTokenManager;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * okhttp client for {@code fantasysports.yahooapis.com}. Adds the bearer token, refreshes it once
 * on a 401 and stops calling while Yahoo's rate limit is in effect.
 */
public class YahooFantasyService implements YahooApi {

    private static final Logger log = LoggerFactory.getLogger(YahooFantasyService.class);

    public static final String BASE_URL = "https://fantasysports.yahooapis.com/fantasy/v2/";
    private static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private final OkHttpClient client;
    private final String baseUrl;
    private final YahooTokenManager tokens;

    private final AtomicBoolean rateLimited = new AtomicBoolean(false);
    private final AtomicLong rateLimitResetTime = new AtomicLong(0);

    // --- CACHES ---
    private final TtlCache<String, String> teamKeyCache = new TtlCache<>(60 * 60 * 1000); // 1h

    public YahooFantasyService(YahooTokenManager tokens) {
        this(tokens, BASE_URL, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    public YahooFantasyService(YahooTokenManager tokens, String baseUrl, OkHttpClient baseClient) {
        this.tokens = tokens;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.client = baseClient.newBuilder()
                .addInterceptor(chain -> {
                    if (rateLimited.get()) {
                        if (System.currentTimeMillis() > rateLimitResetTime.get()) {
                            rateLimited.set(false);
                        } else {
                            throw new IOException("RATE_LIMITED");
                        }
                    }

                    Request original = chain.request();
                    Response response = chain.proceed(withToken(original, tokens.accessToken()));

                    if (response.code() == 401 && tokens.refreshToken() != null) {
                        response.close();
                        log.info("Yahoo answered 401, refreshing access token");
                        String fresh;
                        try {
                            fresh = tokens.refresh();
                        } catch (IllegalStateException e) {
                            throw new IOException("Yahoo token expired and cannot be refreshed: " + e.getMessage(), e);
                        }
                        response = chain.proceed(withToken(original, fresh));
                    }

                    if (response.code() == 429) {
                        rateLimited.set(true);
                        long retryAfter = DEFAULT_RETRY_AFTER_SECONDS;
                        String retryHeader = response.header("Retry-After");
                        if (retryHeader != null) {
                            try {
                                retryAfter = Long.parseLong(retryHeader.trim());
                            } catch (NumberFormatException e) {
                                log.debug("Unparseable Retry-After header '{}'", retryHeader);
                            }
                        }
                        rateLimitResetTime.set(System.currentTimeMillis() + retryAfter * 1000);
                        response.close();
                        throw new IOException("RATE_LIMITED");
                    }
                    return response;
                })
                .build();
    }

    private static Request withToken(Request request, String token) {
        if (token == null) return request;
        return request.newBuilder()
                .header("Authorization", "Bearer " + token.trim())
                .header("Accept", "application/json")
                .build();
    }

    @Override
    public JSONObject call(String resourcePath) throws IOException {
        HttpUrl url = HttpUrl.parse(baseUrl + resourcePath);
        if (url == null) {
            throw new IOException("Invalid Yahoo resource path: " + resourcePath);
        }
        url = url.newBuilder().setQueryParameter("format", "json").build();

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Yahoo API error " + response.code() + " on " + resourcePath + ": " + abbreviate(text));
            }
            try {
                return new JSONObject(text);
            } catch (JSONException e) {
                throw new IOException("Yahoo API returned invalid JSON for " + resourcePath, e);
            }
        }
    }

    @Override
    public String getUserTeamKey(String leagueKey) throws IOException {
        return teamKeyCache.getOrLoad(leagueKey, () -> {
            JSONObject json = call("users;use_login=1/games;game_keys=nfl/teams");
            List<String> teamKeys = new ArrayList<>();
            collectTeamKeys(json, teamKeys);
            String prefix = leagueKey + ".t.";
            for (String key : teamKeys) {
                if (key.startsWith(prefix)) return key;
            }
            log.warn("No team of the logged-in user found in league {}", leagueKey);
            return null;
        });
    }

    static void collectTeamKeys(Object node, List<String> out) {
        if (node instanceof JSONObject obj) {
            for (String key : obj.keySet()) {
                Object value = obj.opt(key);
                if ("team_key".equals(key) && value instanceof String s) {
                    out.add(s);
                } else {
                    collectTeamKeys(value, out);
                }
            }
        } else if (node instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                collectTeamKeys(array.opt(i), out);
            }
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
