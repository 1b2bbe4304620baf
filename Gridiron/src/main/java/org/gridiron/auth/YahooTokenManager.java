package org.gridiron.auth;

import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.gridiron.config.GridironConfig;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the Yahoo OAuth2 tokens. Tokens come from the authorization-code grant on first setup
 * (see {@link YahooAuthSetup}) and from the refresh-token grant afterwards. New tokens are written
 * back into the {@code .env} file so the next start picks them up.
 */
public class YahooTokenManager {

    private static final Logger log = LoggerFactory.getLogger(YahooTokenManager.class);

    public static final String TOKEN_URL = "https://api.login.yahoo.com/oauth2/get_token";
    public static final String AUTH_URL = "https://api.login.yahoo.com/oauth2/request_auth";
    /** Out-of-band redirect: Yahoo shows the verification code instead of redirecting. */
    public static final String REDIRECT_URI = "oob";

    private final OkHttpClient client;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Path envFile;

    private String accessToken;
    private String refreshToken;

    public YahooTokenManager(GridironConfig config, OkHttpClient client) {
        this(config, client, TOKEN_URL);
    }

    public YahooTokenManager(GridironConfig config, OkHttpClient client, String tokenUrl) {
        this.client = client;
        this.tokenUrl = tokenUrl;
        this.clientId = config.get(GridironConfig.YAHOO_CLIENT_ID);
        this.clientSecret = config.get(GridironConfig.YAHOO_CLIENT_SECRET);
        this.accessToken = config.get(GridironConfig.YAHOO_ACCESS_TOKEN);
        this.refreshToken = config.get(GridironConfig.YAHOO_REFRESH_TOKEN);
        this.envFile = config.envFile();
    }

    public synchronized String accessToken() {
        return accessToken;
    }

    public synchronized String refreshToken() {
        return refreshToken;
    }

    public Path envFile() {
        return envFile;
    }

    // --- AUTHORIZATION CODE ---

    /** The Yahoo consent page; after "Agree" it displays the verification code for {@link #exchangeCode}. */
    public String authorizationUrl() {
        requireClientCredentials(false);
        return HttpUrl.get(AUTH_URL).newBuilder()
                .addQueryParameter("client_id", clientId)
                .addQueryParameter("redirect_uri", REDIRECT_URI)
                .addQueryParameter("response_type", "code")
                .addQueryParameter("language", "en-us")
                .build()
                .toString();
    }

    /**
     * Trades a verification code from the consent page for a fresh access and refresh token pair.
     *
     * @return the new access token
     * @throws IllegalArgumentException if the code is blank
     * @throws IllegalStateException if client id or secret are missing
     */
    public synchronized String exchangeCode(String verificationCode) throws IOException {
        if (verificationCode == null || verificationCode.isBlank()) {
            throw new IllegalArgumentException("Verification code is empty");
        }
        requireClientCredentials(true);

        FormBody body = new FormBody.Builder()
                .add("client_id", clientId)
                .add("client_secret", clientSecret)
                .add("redirect_uri", REDIRECT_URI)
                .add("code", verificationCode.trim())
                .add("grant_type", "authorization_code")
                .build();
        requestTokens(body, "Code exchange", " (code expired or already used? open the authorization URL again)");
        log.info("Yahoo app authorized");
        return accessToken;
    }

    // --- REFRESH ---

    /**
     * Exchanges the refresh token for a new access token.
     *
     * @return the new access token
     * @throws IllegalStateException if client id, secret or refresh token are missing
     * @throws IOException on transport errors or a non-200 answer (400 usually means the refresh
     *                     token expired and the app must be re-authorized)
     */
    public synchronized String refresh() throws IOException {
        if (clientId == null || clientSecret == null || refreshToken == null) {
            throw new IllegalStateException("Missing Yahoo credentials: "
                    + GridironConfig.YAHOO_CLIENT_ID + ", " + GridironConfig.YAHOO_CLIENT_SECRET + " and "
                    + GridironConfig.YAHOO_REFRESH_TOKEN + " are required");
        }

        FormBody body = new FormBody.Builder()
                .add("client_id", clientId)
                .add("client_secret", clientSecret)
                .add("refresh_token", refreshToken)
                .add("grant_type", "refresh_token")
                .build();
        requestTokens(body, "Token refresh",
                " (refresh token expired? re-authorize with " + YahooAuthSetup.class.getSimpleName() + ")");
        return accessToken;
    }

    private void requestTokens(FormBody body, String action, String badRequestHint) throws IOException {
        Request request = new Request.Builder().url(tokenUrl).post(body).build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (response.code() != 200) {
                String hint = response.code() == 400 ? badRequestHint : "";
                throw new IOException(action + " failed with HTTP " + response.code() + hint + ": " + text);
            }

            JSONObject json;
            try {
                json = new JSONObject(text);
            } catch (JSONException e) {
                throw new IOException("Token endpoint returned invalid JSON", e);
            }
            String newAccess = json.optString("access_token", null);
            if (newAccess == null || newAccess.isBlank()) {
                throw new IOException("Token endpoint answered without an access_token");
            }
            this.accessToken = newAccess;
            this.refreshToken = json.optString("refresh_token", refreshToken);
            log.info("Yahoo token issued, expires in {}s", json.optInt("expires_in", 3600));
        }

        persist();
    }

    private void requireClientCredentials(boolean needSecret) {
        if (clientId == null || (needSecret && clientSecret == null)) {
            throw new IllegalStateException("Missing Yahoo credentials: " + GridironConfig.YAHOO_CLIENT_ID
                    + (needSecret ? " and " + GridironConfig.YAHOO_CLIENT_SECRET + " are" : " is") + " required");
        }
    }

    // --- ENV FILE ---

    void persist() throws IOException {
        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put(GridironConfig.YAHOO_ACCESS_TOKEN, accessToken);
        if (refreshToken != null) tokens.put(GridironConfig.YAHOO_REFRESH_TOKEN, refreshToken);
        saveToEnv(tokens);
    }

    /** Rewrites the given keys' lines of the env file, appending the ones that are absent. */
    public synchronized void saveToEnv(Map<String, String> entries) throws IOException {
        if (envFile == null) return;
        List<String> lines = Files.exists(envFile)
                ? Files.readAllLines(envFile, StandardCharsets.UTF_8)
                : new ArrayList<>();

        Set<String> pending = new LinkedHashSet<>(entries.keySet());
        List<String> updated = new ArrayList<>();
        for (String line : lines) {
            int eq = line.indexOf('=');
            String key = eq > 0 ? line.substring(0, eq).trim() : null;
            if (key != null && entries.containsKey(key)) {
                updated.add(key + "=" + entries.get(key));
                pending.remove(key);
            } else {
                updated.add(line);
            }
        }
        for (String key : pending) {
            updated.add(key + "=" + entries.get(key));
        }

        Files.write(envFile, updated, StandardCharsets.UTF_8);
    }
}
