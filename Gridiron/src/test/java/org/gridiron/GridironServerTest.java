package org.gridiron;

import org.gridiron.lineup.LineupOptimizer;
import org.gridiron.service.FakeYahooApi;
import org.gridiron.service.LineupInsightService;
import org.gridiron.service.LineupService;
import org.gridiron.tool.ToolContext;
import org.gridiron.tool.ToolManager;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class GridironServerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private GridironServer server() {
        FakeYahooApi yahoo = new FakeYahooApi()
                .teamKey("423.l.1.t.1")
                .respond("team/423.l.1.t.1/matchups", new JSONObject().put("fantasy_content", new JSONObject()));
        LineupOptimizer optimizer = LineupOptimizer.withDefaults();
        LineupService lineups = new LineupService(yahoo, List.of(), optimizer, new LineupInsightService(null), executor);
        return new GridironServer(ToolManager.withDefaultTools(new ToolContext(yahoo, lineups, optimizer.normalizer())), null);
    }

    @Test
    void answersOneLinePerRequestAndSkipsBlankLines() throws IOException {
        String input = "{\"list\": true}\n"
                + "\n"
                + "{\"tool\": \"ff_get_matchup\", \"arguments\": {\"league_key\": \"423.l.1\"}}\n"
                + "not json\n";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        server().serve(new BufferedReader(new StringReader(input)), new PrintStream(bytes, true, StandardCharsets.UTF_8));

        String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).hasSize(3);
        assertThat(new JSONObject(lines[0]).getJSONArray("tools").length()).isEqualTo(3);
        assertThat(new JSONObject(lines[1]).getString("team_key")).isEqualTo("423.l.1.t.1");
        assertThat(new JSONObject(lines[2]).getString("error")).startsWith("Request is not valid JSON");
    }

    @Test
    void requestWithoutToolIsError() {
        assertThat(server().handle("{\"arguments\": {}}").getString("error")).contains("\"tool\"");
    }

    @Test
    void questionWithoutAgentIsError() {
        assertThat(server().handle("{\"ask\": \"Who should I start?\"}").getString("error"))
                .startsWith("Agent unavailable");
        assertThat(server().handle("{\"ask\": \"\"}").getString("error")).isEqualTo("Question is empty");
    }
}
