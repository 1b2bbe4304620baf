package org.gridiron.tool;

import org.json.JSONObject;

import java.io.IOException;

public class GetMatchupTool implements FantasyTool {

    @Override
    public String name() {
        return "ff_get_matchup";
    }

    @Override
    public String description() {
        return "Get matchup information for your team in a specific week";
    }

    @Override
    public JSONObject inputSchema() {
        return ToolArguments.schema(new String[][]{
                {"league_key", "string", "League identifier, e.g. 423.l.12345"},
                {"week", "integer", "Week number (defaults to the current week)"}
        }, "league_key");
    }

    @Override
    public JSONObject execute(JSONObject arguments, ToolContext ctx) throws IOException {
        String leagueKey = ToolArguments.requireString(arguments, "league_key");
        Integer week = ToolArguments.optionalInt(arguments, "week");

        String teamKey = ctx.yahoo().getUserTeamKey(leagueKey);
        if (teamKey == null) {
            return new JSONObject().put("error", "Could not find your team in league " + leagueKey);
        }

        JSONObject data = ctx.yahoo().getMatchups(teamKey, week);
        return new JSONObject()
                .put("league_key", leagueKey)
                .put("team_key", teamKey)
                .put("week", week == null ? "current" : week)
                .put("message", "Matchup data retrieved")
                .put("raw_matchups", data);
    }
}
