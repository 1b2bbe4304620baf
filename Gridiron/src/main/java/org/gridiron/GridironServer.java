package org.gridiron;

import dev.langchain4j.model.chat.ChatModel;
import okhttp3.OkHttpClient;
import org.gridiron.auth.YahooTokenManager;
import org.gridiron.config.GridironConfig;
import org.gridiron.lineup.LineupOptimizer;
import org.gridiron.service.LineupInsightService;
import org.gridiron.service.LineupService;
import org.gridiron.service.SleeperService;
import org.gridiron.service.YahooFantasyService;
import org.gridiron.tool.FantasyAgent;
import org.gridiron.tool.FantasyAgentTools;
import org.gridiron.tool.ToolContext;
import org.gridiron.tool.ToolManager;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point. Reads one JSON request per line on stdin and answers with one JSON line on stdout.
 *
 * <pre>
 * {"list": true}
 * {"tool": "ff_build_lineup", "arguments": {"league_key": "423.l.12345", "strategy": "floor"}}
 * {"ask": "Who should I start at flex this week in 423.l.12345?"}
 * </pre>
 *
 * Logs go to stderr so stdout stays machine-readable.
 */
public class GridironServer {

    private static final Logger log = LoggerFactory.getLogger(GridironServer.class);

    private final ToolManager tools;
    private final FantasyAgent agent;

    public GridironServer(ToolManager tools, FantasyAgent agent) {
        this.tools = tools;
        this.agent = agent;
    }

    public static void main(String[] args) throws IOException {
        GridironConfig config = GridironConfig.load();
        ExecutorService executor = Executors.newFixedThreadPool(6);

        OkHttpClient http = new OkHttpClient();
        YahooTokenManager tokens = new YahooTokenManager(config, http);
        YahooFantasyService yahoo = new YahooFantasyService(tokens);
        SleeperService sleeper = new SleeperService(config.sleeperScoring(), config.season(), executor);

        ChatModel model = LineupInsightService.chatModel(config);
        LineupOptimizer optimizer = LineupOptimizer.withDefaults();
        LineupService lineups = new LineupService(
                yahoo, List.of(sleeper), optimizer, new LineupInsightService(model), executor);

        ToolManager tools = ToolManager.withDefaultTools(new ToolContext(yahoo, lineups, optimizer.normalizer()));
        FantasyAgent agent = new FantasyAgent(model, new FantasyAgentTools(tools));

        log.info("Gridiron ready (season {}, scoring {}, agent {})",
                config.season(), config.sleeperScoring(), agent.isAvailable() ? "on" : "off");
        try {
            new GridironServer(tools, agent).serve(
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new PrintStream(System.out, true, StandardCharsets.UTF_8));
        } finally {
            executor.shutdownNow();
        }
    }

    public void serve(BufferedReader in, PrintStream out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) continue;
            out.println(handle(line).toString());
        }
    }

    JSONObject handle(String line) {
        JSONObject request;
        try {
            request = new JSONObject(line);
        } catch (JSONException e) {
            return new JSONObject().put("error", "Request is not valid JSON: " + e.getMessage());
        }

        if (request.optBoolean("list", false)) {
            return new JSONObject().put("tools", tools.listTools());
        }
        if (request.has("ask")) {
            return ask(request.optString("ask", ""));
        }
        String toolName = request.optString("tool", null);
        if (toolName == null || toolName.isBlank()) {
            return new JSONObject().put("error", "Request needs a \"tool\", \"ask\" or \"list\" field");
        }
        return tools.dispatch(toolName, request.optJSONObject("arguments"));
    }

    private JSONObject ask(String question) {
        if (question.isBlank()) {
            return new JSONObject().put("error", "Question is empty");
        }
        if (agent == null || !agent.isAvailable()) {
            return new JSONObject().put("error", "Agent unavailable: MISTRAL_API_KEY is not configured");
        }
        try {
            return new JSONObject().put("answer", agent.ask(question));
        } catch (RuntimeException e) {
            log.error("Agent failed on question '{}'", question, e);
            return new JSONObject().put("error", "Agent failed: " + e.getMessage());
        }
    }
}
