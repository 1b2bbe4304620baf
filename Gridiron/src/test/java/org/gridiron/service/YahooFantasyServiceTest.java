package org.gridiron.service;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.gridiron.auth.YahooTokenManager;
import org.gridiron.config.GridironConfig;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YahooFantasyServiceTest {

    @TempDir
    Path tempDir;

    private MockWebServer yahoo;
    private MockWebServer oauth;
    private YahooFantasyService service;

    @BeforeEach
    void setUp() throws IOException {
        yahoo = new MockWebServer();
        oauth = new MockWebServer();
        yahoo.start();
        oauth.start();

        GridironConfig config = GridironConfig.fromMap(Map.of(
                GridironConfig.YAHOO_CLIENT_ID, "client",
                GridironConfig.YAHOO_CLIENT_SECRET, "secret",
                GridironConfig.YAHOO_ACCESS_TOKEN, "stale",
                GridironConfig.YAHOO_REFRESH_TOKEN, "refresh"), tempDir.resolve(".env"));
        OkHttpClient http = new OkHttpClient();
        YahooTokenManager tokens = new YahooTokenManager(config, http, oauth.url("/token").toString());
        service = new YahooFantasyService(tokens, yahoo.url("/fantasy/v2/").toString(), http);
    }

    @AfterEach
    void tearDown() throws IOException {
        yahoo.shutdown();
        oauth.shutdown();
    }

    @Test
    void callSendsBearerTokenAndJsonFormat() throws Exception {
        yahoo.enqueue(new MockResponse().setBody("{\"fantasy_content\":{}}"));

        JSONObject json = service.getLeagueSettings("423.l.12345");

        assertThat(json.has("fantasy_content")).isTrue();
        RecordedRequest request = yahoo.takeRequest();
        assertThat(request.getPath()).isEqualTo("/fantasy/v2/league/423.l.12345/settings?format=json");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer stale");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void rosterPathCarriesWeek() throws Exception {
        yahoo.enqueue(new MockResponse().setBody("{}"));

        service.getRoster("423.l.12345.t.3", 7);

        assertThat(yahoo.takeRequest().getPath()).startsWith("/fantasy/v2/team/423.l.12345.t.3/roster;week=7");
    }

    @Test
    void unauthorizedTriggersOneRefreshAndRetry() throws Exception {
        yahoo.enqueue(new MockResponse().setResponseCode(401));
        yahoo.enqueue(new MockResponse().setBody("{\"ok\":true}"));
        oauth.enqueue(new MockResponse().setBody("{\"access_token\":\"fresh\",\"refresh_token\":\"refresh2\"}"));

        JSONObject json = service.call("game/nfl");

        assertThat(json.getBoolean("ok")).isTrue();
        assertThat(yahoo.takeRequest().getHeader("Authorization")).isEqualTo("Bearer stale");
        assertThat(yahoo.takeRequest().getHeader("Authorization")).isEqualTo("Bearer fresh");
        assertThat(oauth.getRequestCount()).isEqualTo(1);
    }

    @Test
    void rateLimitBlocksFurtherCallsUntilReset() {
        yahoo.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "120"));

        assertThatThrownBy(() -> service.call("game/nfl")).isInstanceOf(IOException.class).hasMessageContaining("RATE_LIMITED");
        assertThatThrownBy(() -> service.call("game/nfl")).isInstanceOf(IOException.class).hasMessageContaining("RATE_LIMITED");
        assertThat(yahoo.getRequestCount()).isEqualTo(1);
    }

    @Test
    void serverErrorIsIoException() {
        yahoo.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> service.call("game/nfl"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("500");
    }

    @Test
    void invalidJsonIsIoException() {
        yahoo.enqueue(new MockResponse().setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> service.call("game/nfl"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void findsTeamKeyOfLeagueAndCachesIt() throws Exception {
        yahoo.enqueue(new MockResponse().setBody(teamsResponse("423.l.999.t.1", "423.l.12345.t.3").toString()));

        assertThat(service.getUserTeamKey("423.l.12345")).isEqualTo("423.l.12345.t.3");
        assertThat(service.getUserTeamKey("423.l.12345")).isEqualTo("423.l.12345.t.3");
        assertThat(yahoo.getRequestCount()).isEqualTo(1);
        assertThat(yahoo.takeRequest().getPath()).startsWith("/fantasy/v2/users;use_login=1/games;game_keys=nfl/teams");
    }

    @Test
    void unknownLeagueGivesNullTeamKey() throws Exception {
        yahoo.enqueue(new MockResponse().setBody(teamsResponse("423.l.999.t.1").toString()));

        assertThat(service.getUserTeamKey("423.l.12345")).isNull();
    }

    @Test
    void collectsTeamKeysAtAnyDepth() {
        List<String> keys = new ArrayList<>();

        YahooFantasyService.collectTeamKeys(teamsResponse("a.t.1", "b.t.2"), keys);

        assertThat(keys).containsExactlyInAnyOrder("a.t.1", "b.t.2");
    }

    private static JSONObject teamsResponse(String... teamKeys) {
        JSONObject teams = new JSONObject();
        for (int i = 0; i < teamKeys.length; i++) {
            teams.put(String.valueOf(i), new JSONObject().put("team",
                    new JSONArray().put(new JSONArray().put(new JSONObject().put("team_key", teamKeys[i])))));
        }
        teams.put("count", teamKeys.length);
        JSONObject game = new JSONObject().put("game", new JSONArray()
                .put(new JSONObject().put("game_key", "423"))
                .put(new JSONObject().put("teams", teams)));
        JSONObject user = new JSONObject().put("user", new JSONArray()
                .put(new JSONObject().put("guid", "ABC"))
                .put(new JSONObject().put("games", new JSONObject().put("0", game))));
        return new JSONObject().put("fantasy_content", new JSONObject().put("users", new JSONObject().put("0", user)));
    }
}
