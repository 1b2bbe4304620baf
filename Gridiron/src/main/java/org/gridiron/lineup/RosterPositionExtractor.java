package org.gridiron.lineup;

import org.json.JSONObject;

import java.util.List;

/**
 * Reads a league's slot template out of a provider settings response.
 */
public interface RosterPositionExtractor {

    /**
     * Never throws. Any structural mismatch yields an empty list, which callers treat as
     * "use the default template".
     */
    List<RosterPosition> extract(JSONObject settingsResponse);
}
