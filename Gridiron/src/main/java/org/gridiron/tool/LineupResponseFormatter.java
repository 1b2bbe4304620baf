package org.gridiron.tool;

import org.gridiron.lineup.LineupResult;
import org.gridiron.lineup.Player;
import org.gridiron.lineup.ScoredPlayer;
import org.gridiron.service.LineupReport;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shapes a {@link LineupReport} into the JSON returned by {@code ff_build_lineup}.
 */
public final class LineupResponseFormatter {

    static final int BENCH_LIMIT = 5;

    private LineupResponseFormatter() {}

    public static JSONObject format(LineupReport report) {
        LineupResult result = report.result();
        if (!result.status().isOk()) {
            return failure(result);
        }

        JSONObject lineup = new JSONObject();
        for (Map.Entry<String, ScoredPlayer> entry : result.starters().entrySet()) {
            lineup.put(entry.getKey(), player(entry.getValue()));
        }

        JSONArray bench = new JSONArray();
        List<ScoredPlayer> benchPlayers = result.bench();
        for (int i = 0; i < Math.min(BENCH_LIMIT, benchPlayers.size()); i++) {
            ScoredPlayer sp = benchPlayers.get(i);
            bench.put(new JSONObject()
                    .put("name", sp.name())
                    .put("position", sp.position())
                    .put("composite_score", score(sp))
                    .put("tier", sp.tier().name()));
        }

        JSONObject response = new JSONObject()
                .put("league_key", report.leagueKey())
                .put("team_key", report.teamKey())
                .put("week", report.week() == null ? "current" : report.week())
                .put("status", result.status().key())
                .put("optimal_lineup", lineup)
                .put("bench", bench)
                .put("recommendations", new JSONArray(result.recommendations()))
                .put("analysis", analysis(result))
                .put("warnings", new JSONArray(result.warnings()));
        if (report.insight() != null) {
            response.put("llm_analysis", report.insight());
        }
        return response;
    }

    static JSONObject failure(LineupResult result) {
        return new JSONObject()
                .put("status", result.status().key())
                .put("error", "Lineup optimization failed")
                .put("errors", new JSONArray(result.errors()))
                .put("warnings", new JSONArray(result.warnings()))
                .put("details", new JSONArray(result.issues().stream().map(i -> i.describe()).toArray()))
                .put("data_quality", dataQuality(result));
    }

    static JSONObject player(ScoredPlayer sp) {
        Player p = sp.player();
        JSONObject json = new JSONObject()
                .put("name", p.getName())
                .put("position", p.getPosition())
                .put("tier", sp.tier().name())
                .put("team", orNull(p.getTeam()))
                .put("opponent", orNull(p.getOpponent()))
                .put("matchup_score", p.getMatchupScore() == null ? JSONObject.NULL : round1(p.getMatchupScore()))
                .put("matchup", orNull(p.getMatchupDescription()))
                .put("composite_score", score(sp))
                .put("yahoo_proj", p.getProjectionA() == null ? JSONObject.NULL : round1(p.getProjectionA()))
                .put("sleeper_proj", p.getProjectionB() == null ? JSONObject.NULL : round1(p.getProjectionB()))
                .put("trending", trending(p.getTrendingScore()))
                .put("floor", p.getFloorProjection() == null ? JSONObject.NULL : round1(p.getFloorProjection()))
                .put("ceiling", p.getCeilingProjection() == null ? JSONObject.NULL : round1(p.getCeilingProjection()));
        if (p.getInjuryStatus() != null) {
            json.put("status", p.getInjuryStatus());
        }
        return json;
    }

    static String trending(int adds) {
        return String.format(Locale.US, "%,d adds", adds);
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static Object score(ScoredPlayer sp) {
        return sp.isScored() ? round1(sp.compositeScore()) : JSONObject.NULL;
    }

    private static JSONObject analysis(LineupResult result) {
        return new JSONObject()
                .put("total_players", result.dataQuality().totalPlayers())
                .put("valid_players", result.dataQuality().validPlayers())
                .put("players_with_projections", result.dataQuality().playersWithProjections())
                .put("players_with_matchup_data", result.dataQuality().playersWithMatchupData())
                .put("strategy_used", result.strategyUsed() == null ? JSONObject.NULL : result.strategyUsed().key())
                .put("data_sources", new JSONArray(dataSources(result)));
    }

    private static List<String> dataSources(LineupResult result) {
        boolean secondary = result.starters().values().stream()
                .anyMatch(sp -> sp.player().getProjectionB() != null || sp.player().hasMatchupData());
        return secondary ? List.of("Yahoo", "Sleeper") : List.of("Yahoo");
    }

    private static JSONObject dataQuality(LineupResult result) {
        return new JSONObject()
                .put("total_players", result.dataQuality().totalPlayers())
                .put("valid_players", result.dataQuality().validPlayers())
                .put("players_with_projections", result.dataQuality().playersWithProjections())
                .put("players_with_matchup_data", result.dataQuality().playersWithMatchupData());
    }

    private static Object orNull(String value) {
        return value == null ? JSONObject.NULL : value;
    }
}
