package org.gridiron.tool;

import org.gridiron.lineup.Strategy;
import org.gridiron.service.LineupReport;
import org.json.JSONObject;

import java.io.IOException;

public class BuildLineupTool implements FantasyTool {

    @Override
    public String name() {
        return "ff_build_lineup";
    }

    @Override
    public String description() {
        return "Build the optimal starting lineup for your team using projections, matchups and trends. "
                + "Strategies: " + Strategy.allowedValues();
    }

    @Override
    public JSONObject inputSchema() {
        return ToolArguments.schema(new String[][]{
                {"league_key", "string", "League identifier"},
                {"week", "integer", "Week number (defaults to the current week)"},
                {"strategy", "string", "One of " + Strategy.allowedValues() + " (default balanced)"},
                {"use_llm", "boolean", "Add a short narrative from the language model"}
        }, "league_key");
    }

    @Override
    public JSONObject execute(JSONObject arguments, ToolContext ctx) throws IOException {
        String leagueKey = ToolArguments.requireString(arguments, "league_key");
        Integer week = ToolArguments.optionalInt(arguments, "week");
        String strategy = ToolArguments.optionalString(arguments, "strategy");
        boolean useLlm = ToolArguments.optionalBoolean(arguments, "use_llm", false);

        String teamKey = ctx.yahoo().getUserTeamKey(leagueKey);
        if (teamKey == null) {
            return new JSONObject().put("error", "Could not find your team in league " + leagueKey);
        }

        LineupReport report = ctx.lineupService().build(
                leagueKey, teamKey, week, strategy == null ? Strategy.BALANCED.key() : strategy, useLlm);
        return LineupResponseFormatter.format(report);
    }
}
