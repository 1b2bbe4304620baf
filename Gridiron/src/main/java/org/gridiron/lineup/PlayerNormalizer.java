package org.gridiron.lineup;

import org.json.JSONObject;

import java.util.List;

/**
 * Turns provider roster payloads into {@link Player}s. Malformed entries are skipped and counted;
 * an empty result is reported by the caller as a roster parse failure.
 */
public interface PlayerNormalizer {

    NormalizedRoster normalize(JSONObject rosterResponse);

    NormalizedRoster normalizeEntries(List<Object> rawEntries);
}
