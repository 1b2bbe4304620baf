package org.gridiron.lineup;

import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Extracts {@code roster_positions} from a Yahoo {@code league/{key}/settings} response.
 *
 * <p>Yahoo ships the same data in several layouts: {@code fantasy_content.league} may be a list
 * (metadata first, settings later) or a map, {@code settings} may be a list of maps or a map, and
 * {@code roster_positions} itself comes as one of the {@link RosterShape}s below.
 */
public class YahooRosterPositionExtractor implements RosterPositionExtractor {

    private static final Logger log = LoggerFactory.getLogger(YahooRosterPositionExtractor.class);

    enum RosterShape {
        /** {@code [{"roster_position": {"position": "QB", "count": 1}}, ...]} */
        WRAPPED_LIST,
        /** {@code [{"position": "QB", "count": 1}, ...]} */
        FLAT_LIST,
        /** {@code {"0": {"roster_position": {...}}, "1": {...}, "count": 2}} */
        KEYED_MAP,
        UNRECOGNIZED;

        static RosterShape of(Object rosterData) {
            if (rosterData instanceof JSONArray array) {
                if (array.isEmpty()) return UNRECOGNIZED;
                Object first = array.opt(0);
                if (first instanceof JSONObject obj) {
                    if (obj.has("roster_position")) return WRAPPED_LIST;
                    if (obj.has("position")) return FLAT_LIST;
                }
                return UNRECOGNIZED;
            }
            if (rosterData instanceof JSONObject) return KEYED_MAP;
            return UNRECOGNIZED;
        }
    }

    @Override
    public List<RosterPosition> extract(JSONObject settingsResponse) {
        if (settingsResponse == null) return Collections.emptyList();
        try {
            return locateRosterPositions(settingsResponse)
                    .map(this::parse)
                    .orElse(Collections.emptyList());
        } catch (MalformedSettingsException e) {
            log.warn("Roster positions unreadable, default template applies: {}", e.getMessage());
            return Collections.emptyList();
        } catch (RuntimeException e) {
            log.warn("Unexpected settings layout, default template applies", e);
            return Collections.emptyList();
        }
    }

    // --- LOCATING roster_positions ---

    Optional<Object> locateRosterPositions(JSONObject settingsResponse) {
        JSONObject content = settingsResponse.optJSONObject("fantasy_content");
        if (content == null) return Optional.empty();

        Object league = content.opt("league");
        if (league instanceof JSONArray items) {
            for (int i = 0; i < items.length(); i++) {
                JSONObject item = items.optJSONObject(i);
                if (item == null || !item.has("settings")) continue;
                Optional<Object> found = fromSettings(item.opt("settings"));
                if (found.isPresent()) return found;
            }
        } else if (league instanceof JSONObject leagueObj) {
            return fromSettings(leagueObj.opt("settings"));
        }
        return Optional.empty();
    }

    private Optional<Object> fromSettings(Object settings) {
        if (settings instanceof JSONArray list) {
            for (int i = 0; i < list.length(); i++) {
                JSONObject setting = list.optJSONObject(i);
                if (setting != null && setting.has("roster_positions")) {
                    return Optional.of(setting.get("roster_positions"));
                }
            }
        } else if (settings instanceof JSONObject map && map.has("roster_positions")) {
            return Optional.of(map.get("roster_positions"));
        }
        return Optional.empty();
    }

    // --- PARSING BY SHAPE ---

    List<RosterPosition> parse(Object rosterData) {
        List<RosterPosition> positions = new ArrayList<>();
        switch (RosterShape.of(rosterData)) {
            case WRAPPED_LIST -> {
                JSONArray array = (JSONArray) rosterData;
                for (int i = 0; i < array.length(); i++) {
                    JSONObject item = array.optJSONObject(i);
                    if (item != null) addEntry(positions, item.optJSONObject("roster_position"));
                }
            }
            case FLAT_LIST -> {
                JSONArray array = (JSONArray) rosterData;
                for (int i = 0; i < array.length(); i++) {
                    addEntry(positions, array.optJSONObject(i));
                }
            }
            case KEYED_MAP -> {
                JSONObject map = (JSONObject) rosterData;
                for (String key : sortedKeys(map)) {
                    if ("count".equals(key)) continue;
                    JSONObject value = map.optJSONObject(key);
                    if (value == null) continue;
                    addEntry(positions, value.has("roster_position") ? value.optJSONObject("roster_position") : value);
                }
            }
            case UNRECOGNIZED -> {
                return Collections.emptyList();
            }
        }
        return positions;
    }

    private void addEntry(List<RosterPosition> positions, JSONObject entry) {
        if (entry == null) return;
        String position = entry.optString("position", "").trim();
        if (position.isEmpty()) return;
        positions.add(new RosterPosition(position, coerceCount(entry.opt("count"))));
    }

    static int coerceCount(Object raw) {
        if (raw == null || raw == JSONObject.NULL) return 1;
        int value;
        if (raw instanceof Number n) {
            value = n.intValue();
        } else {
            try {
                value = Integer.parseInt(String.valueOf(raw).trim());
            } catch (NumberFormatException e) {
                throw new MalformedSettingsException("count is not numeric: '" + raw + "'", e);
            }
        }
        return Math.max(1, value);
    }

    // Numbered keys keep Yahoo's order ("0", "1", ... "10"), other keys follow alphabetically.
    private static List<String> sortedKeys(JSONObject map) {
        List<String> keys = new ArrayList<>(map.keySet());
        keys.sort((a, b) -> {
            boolean na = a.chars().allMatch(Character::isDigit) && !a.isEmpty();
            boolean nb = b.chars().allMatch(Character::isDigit) && !b.isEmpty();
            if (na && nb) return Integer.compare(Integer.parseInt(a), Integer.parseInt(b));
            if (na) return -1;
            if (nb) return 1;
            return a.compareTo(b);
        });
        return keys;
    }

    static class MalformedSettingsException extends RuntimeException {
        MalformedSettingsException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
