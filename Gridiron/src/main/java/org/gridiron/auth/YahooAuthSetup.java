package org.gridiron.auth;

import okhttp3.OkHttpClient;
import org.gridiron.config.GridironConfig;
import org.gridiron.service.YahooApi;
import org.gridiron.service.YahooFantasyService;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Interactive first-time authorization, also used when the refresh token has expired.
 * Prints Yahoo's consent URL, reads the verification code the user pastes back and stores the
 * resulting tokens (plus the account GUID) in the {@code .env} file.
 */
public class YahooAuthSetup {

    private static final Logger log = LoggerFactory.getLogger(YahooAuthSetup.class);

    private final YahooTokenManager tokens;
    private final YahooApi yahoo;

    public YahooAuthSetup(YahooTokenManager tokens, YahooApi yahoo) {
        this.tokens = tokens;
        this.yahoo = yahoo;
    }

    public static void main(String[] args) throws IOException {
        GridironConfig config = GridironConfig.load();
        YahooTokenManager tokens = new YahooTokenManager(config, new OkHttpClient());
        boolean done = new YahooAuthSetup(tokens, new YahooFantasyService(tokens)).run(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintStream(System.out, true, StandardCharsets.UTF_8));
        if (!done) System.exit(1);
    }

    /**
     * @return true when tokens were obtained and saved
     */
    public boolean run(BufferedReader in, PrintStream out) throws IOException {
        out.println("1. Open this URL in your browser and sign in to Yahoo:");
        out.println();
        out.println(tokens.authorizationUrl());
        out.println();
        out.println("2. Click 'Agree'; Yahoo then shows a verification code.");
        out.print("3. Paste the code here: ");
        out.flush();

        String code = in.readLine();
        if (code == null || code.isBlank()) {
            out.println();
            out.println("No verification code entered, nothing was changed.");
            return false;
        }

        tokens.exchangeCode(code);

        String guid = userGuid();
        if (guid != null) {
            tokens.saveToEnv(Map.of(GridironConfig.YAHOO_GUID, guid));
        }
        out.println("Yahoo tokens saved to " + tokens.envFile()
                + (guid == null ? "" : " (account " + guid + ")"));
        return true;
    }

    /** GUID of the logged-in account, or null when Yahoo does not return one. */
    String userGuid() {
        JSONObject response;
        try {
            response = yahoo.call("users;use_login=1");
        } catch (IOException e) {
            log.warn("Could not look up the Yahoo account GUID: {}", e.getMessage());
            return null;
        }
        JSONObject users = response.optJSONObject("fantasy_content") == null
                ? null
                : response.optJSONObject("fantasy_content").optJSONObject("users");
        JSONObject first = users == null ? null : users.optJSONObject("0");
        JSONArray user = first == null ? null : first.optJSONArray("user");
        JSONObject meta = user == null ? null : user.optJSONObject(0);
        String guid = meta == null ? null : meta.optString("guid", null);
        return guid == null || guid.isBlank() ? null : guid;
    }
}
