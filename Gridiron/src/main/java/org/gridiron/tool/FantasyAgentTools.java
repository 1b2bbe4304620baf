package org.gridiron.tool;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import org.json.JSONObject;

/**
 * The fantasy tools as langchain4j tools, so a chat agent can call them. Each method returns the
 * same JSON text the stdin server would print.
 */
public class FantasyAgentTools {

    private final ToolManager tools;

    public FantasyAgentTools(ToolManager tools) {
        this.tools = tools;
    }

    @Tool("Get matchup information for the user's team in a league. Week defaults to the current week.")
    public String getMatchup(@P("League key, e.g. 423.l.12345") String leagueKey,
                             @P(value = "Week number", required = false) Integer week) {
        JSONObject args = new JSONObject().put("league_key", leagueKey);
        if (week != null) args.put("week", week);
        return tools.dispatch("ff_get_matchup", args).toString();
    }

    @Tool("Compare the rosters of two teams in the same league.")
    public String compareTeams(@P("League key") String leagueKey,
                               @P("Key of the first team") String teamKeyA,
                               @P("Key of the second team") String teamKeyB) {
        JSONObject args = new JSONObject()
                .put("league_key", leagueKey)
                .put("team_key_a", teamKeyA)
                .put("team_key_b", teamKeyB);
        return tools.dispatch("ff_compare_teams", args).toString();
    }

    @Tool("Build the optimal starting lineup for the user's team. Strategy is balanced, floor or ceiling.")
    public String buildLineup(@P("League key") String leagueKey,
                              @P(value = "Week number", required = false) Integer week,
                              @P(value = "balanced, floor or ceiling", required = false) String strategy) {
        JSONObject args = new JSONObject().put("league_key", leagueKey);
        if (week != null) args.put("week", week);
        if (strategy != null) args.put("strategy", strategy);
        return tools.dispatch("ff_build_lineup", args).toString();
    }
}
