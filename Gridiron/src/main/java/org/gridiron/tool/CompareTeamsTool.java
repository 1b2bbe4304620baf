package org.gridiron.tool;

import org.gridiron.lineup.NormalizedRoster;
import org.gridiron.lineup.Player;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;

public class CompareTeamsTool implements FantasyTool {

    @Override
    public String name() {
        return "ff_compare_teams";
    }

    @Override
    public String description() {
        return "Compare the rosters of two teams";
    }

    @Override
    public JSONObject inputSchema() {
        return ToolArguments.schema(new String[][]{
                {"league_key", "string", "League identifier"},
                {"team_key_a", "string", "First team identifier"},
                {"team_key_b", "string", "Second team identifier"}
        }, "league_key", "team_key_a", "team_key_b");
    }

    @Override
    public JSONObject execute(JSONObject arguments, ToolContext ctx) throws IOException {
        String leagueKey = ToolArguments.requireString(arguments, "league_key");
        String teamKeyA = ToolArguments.requireString(arguments, "team_key_a");
        String teamKeyB = ToolArguments.requireString(arguments, "team_key_b");

        NormalizedRoster rosterA = ctx.normalizer().normalize(ctx.yahoo().getRoster(teamKeyA, null));
        NormalizedRoster rosterB = ctx.normalizer().normalize(ctx.yahoo().getRoster(teamKeyB, null));

        return new JSONObject()
                .put("league_key", leagueKey)
                .put("team_a", team(teamKeyA, rosterA))
                .put("team_b", team(teamKeyB, rosterB));
    }

    private static JSONObject team(String teamKey, NormalizedRoster roster) {
        JSONArray players = new JSONArray();
        double projected = 0.0;
        for (Player p : roster.players()) {
            JSONObject json = new JSONObject()
                    .put("name", p.getName())
                    .put("position", p.getPosition())
                    .put("team", p.getTeam() == null ? JSONObject.NULL : p.getTeam())
                    .put("selected_position", p.getSelectedPosition() == null ? JSONObject.NULL : p.getSelectedPosition())
                    .put("status", p.getInjuryStatus() == null ? JSONObject.NULL : p.getInjuryStatus())
                    .put("projection", p.getProjectionA() == null ? JSONObject.NULL : LineupResponseFormatter.round1(p.getProjectionA()));
            players.put(json);
            if (p.getProjectionA() != null && !p.isOnProviderBench()) projected += p.getProjectionA();
        }
        return new JSONObject()
                .put("team_key", teamKey)
                .put("roster", players)
                .put("starters_projected_total", LineupResponseFormatter.round1(projected))
                .put("unreadable_entries", roster.invalidCount());
    }
}
