package org.gridiron.service;

import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** In-memory {@link YahooApi}: answers by resource path prefix and records every call. */
public class FakeYahooApi implements YahooApi {

    private final Map<String, JSONObject> responses = new LinkedHashMap<>();
    private final Map<String, IOException> failures = new LinkedHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private String teamKey;

    public FakeYahooApi teamKey(String teamKey) {
        this.teamKey = teamKey;
        return this;
    }

    public FakeYahooApi respond(String pathPrefix, JSONObject response) {
        responses.put(pathPrefix, response);
        return this;
    }

    public FakeYahooApi fail(String pathPrefix, IOException error) {
        failures.put(pathPrefix, error);
        return this;
    }

    public List<String> calls() {
        return calls;
    }

    @Override
    public JSONObject call(String resourcePath) throws IOException {
        calls.add(resourcePath);
        for (Map.Entry<String, IOException> e : failures.entrySet()) {
            if (resourcePath.startsWith(e.getKey())) throw e.getValue();
        }
        for (Map.Entry<String, JSONObject> e : responses.entrySet()) {
            if (resourcePath.startsWith(e.getKey())) return e.getValue();
        }
        throw new IOException("Yahoo API error 404 on " + resourcePath);
    }

    @Override
    public String getUserTeamKey(String leagueKey) {
        return teamKey != null && teamKey.startsWith(leagueKey + ".t.") ? teamKey : null;
    }
}
