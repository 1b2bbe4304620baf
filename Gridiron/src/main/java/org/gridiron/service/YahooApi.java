package org.gridiron.service;

import org.json.JSONObject;

import java.io.IOException;

/**
 * Read access to the Yahoo Fantasy Sports API.
 */
public interface YahooApi {

    /** GET {@code fantasy/v2/<resourcePath>} as JSON. */
    JSONObject call(String resourcePath) throws IOException;

    /** Team key of the logged-in user in the given league, or null if the user has no team there. */
    String getUserTeamKey(String leagueKey) throws IOException;

    default JSONObject getRoster(String teamKey, Integer week) throws IOException {
        return call("team/" + teamKey + "/roster" + weekParam(week));
    }

    default JSONObject getLeagueSettings(String leagueKey) throws IOException {
        return call("league/" + leagueKey + "/settings");
    }

    default JSONObject getMatchups(String teamKey, Integer week) throws IOException {
        return call("team/" + teamKey + "/matchups" + (week == null ? "" : ";weeks=" + week));
    }

    static String weekParam(Integer week) {
        return week == null ? "" : ";week=" + week;
    }
}
