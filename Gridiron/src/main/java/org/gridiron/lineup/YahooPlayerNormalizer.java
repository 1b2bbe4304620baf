package org.gridiron.lineup;

import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes Yahoo {@code team/{key}/roster} responses.
 *
 * <p>A Yahoo player entry is {@code {"player": [[{"player_key": ..}, {"name": {..}}, ...],
 * {"selected_position": [..]}, {"player_projected_points": {..}}]}}: the first element is a list
 * of single-key maps, the rest are maps. Everything is flattened into one map before reading.
 * Already-flat maps ({@code name}, {@code team}, {@code position}, ...) are accepted as well.
 */
public class YahooPlayerNormalizer implements PlayerNormalizer {

    private static final Logger log = LoggerFactory.getLogger(YahooPlayerNormalizer.class);

    @Override
    public NormalizedRoster normalize(JSONObject rosterResponse) {
        return normalizeEntries(locatePlayerEntries(rosterResponse));
    }

    @Override
    public NormalizedRoster normalizeEntries(List<Object> rawEntries) {
        if (rawEntries == null || rawEntries.isEmpty()) {
            return new NormalizedRoster(Collections.emptyList(), 0, 0);
        }
        List<Player> players = new ArrayList<>();
        int invalid = 0;
        for (Object raw : rawEntries) {
            Player player = toPlayer(raw);
            if (player == null) {
                invalid++;
            } else {
                players.add(player);
            }
        }
        if (invalid > 0) {
            log.debug("Skipped {} of {} roster entries without name or position", invalid, rawEntries.size());
        }
        return new NormalizedRoster(players, invalid, rawEntries.size());
    }

    // --- LOCATING PLAYERS ---

    List<Object> locatePlayerEntries(JSONObject rosterResponse) {
        if (rosterResponse == null) return Collections.emptyList();
        JSONObject content = rosterResponse.optJSONObject("fantasy_content");
        if (content == null) return Collections.emptyList();

        JSONObject roster = null;
        Object team = content.opt("team");
        if (team instanceof JSONArray parts) {
            for (int i = 0; i < parts.length() && roster == null; i++) {
                JSONObject part = parts.optJSONObject(i);
                if (part != null) roster = part.optJSONObject("roster");
            }
        } else if (team instanceof JSONObject teamObj) {
            roster = teamObj.optJSONObject("roster");
        }
        if (roster == null) return Collections.emptyList();

        Object players = roster.has("players") ? roster.opt("players") : null;
        if (players == null) {
            JSONObject first = roster.optJSONObject("0");
            if (first != null) players = first.opt("players");
        }
        return asEntryList(players);
    }

    private List<Object> asEntryList(Object players) {
        List<Object> entries = new ArrayList<>();
        if (players instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) entries.add(array.opt(i));
        } else if (players instanceof JSONObject map) {
            List<String> keys = new ArrayList<>(map.keySet());
            keys.removeIf(k -> !k.chars().allMatch(Character::isDigit) || k.isEmpty());
            keys.sort((a, b) -> Integer.compare(Integer.parseInt(a), Integer.parseInt(b)));
            for (String key : keys) entries.add(map.opt(key));
        }
        return entries;
    }

    // --- ENTRY -> PLAYER ---

    Player toPlayer(Object raw) {
        if (!(raw instanceof JSONObject entry)) return null;
        JSONObject flat = entry.has("player") ? flatten(entry.opt("player")) : entry;

        String name = readName(flat.opt("name"));
        String position = readPosition(flat);
        if (name == null || position == null) return null;

        return Player.builder()
                .playerKey(text(flat.opt("player_key")))
                .name(name)
                .team(upper(text(flat.has("editorial_team_abbr") ? flat.opt("editorial_team_abbr") : flat.opt("team"))))
                .position(position)
                .opponent(upper(text(flat.opt("opponent"))))
                .selectedPosition(readSelectedPosition(flat.opt("selected_position")))
                .injuryStatus(text(flat.opt("status")))
                .projectionA(readProjection(flat))
                .build();
    }

    static JSONObject flatten(Object playerArray) {
        JSONObject flat = new JSONObject();
        if (playerArray instanceof JSONArray parts) {
            for (int i = 0; i < parts.length(); i++) {
                Object part = parts.opt(i);
                if (part instanceof JSONArray meta) {
                    for (int j = 0; j < meta.length(); j++) {
                        mergeInto(flat, meta.opt(j));
                    }
                } else {
                    mergeInto(flat, part);
                }
            }
        } else {
            mergeInto(flat, playerArray);
        }
        return flat;
    }

    private static void mergeInto(JSONObject target, Object source) {
        if (!(source instanceof JSONObject obj)) return;
        for (String key : obj.keySet()) {
            target.put(key, obj.get(key));
        }
    }

    private static String readName(Object raw) {
        if (raw instanceof JSONObject nameObj) {
            String full = text(nameObj.opt("full"));
            if (full != null) return full;
            String first = text(nameObj.opt("first"));
            String last = text(nameObj.opt("last"));
            if (first != null && last != null) return first + " " + last;
            return null;
        }
        return text(raw);
    }

    private static String readPosition(JSONObject flat) {
        String primary = text(flat.opt("primary_position"));
        if (primary == null) primary = text(flat.opt("position"));
        if (primary == null) {
            String display = text(flat.opt("display_position"));
            if (display != null) primary = display.split(",")[0];
        }
        if (primary == null) return null;
        String upper = primary.trim().toUpperCase(Locale.ROOT);
        return upper.isEmpty() ? null : upper;
    }

    private static String readSelectedPosition(Object raw) {
        if (raw instanceof JSONArray parts) {
            for (int i = 0; i < parts.length(); i++) {
                JSONObject part = parts.optJSONObject(i);
                if (part != null && part.has("position")) return text(part.opt("position"));
            }
            return null;
        }
        if (raw instanceof JSONObject obj) return text(obj.opt("position"));
        return text(raw);
    }

    private static Double readProjection(JSONObject flat) {
        for (String key : new String[]{"player_projected_points", "player_points"}) {
            JSONObject points = flat.optJSONObject(key);
            if (points != null) {
                Double total = number(points.opt("total"));
                if (total != null) return total;
            }
        }
        return number(flat.opt("projected_points"));
    }

    static Double number(Object raw) {
        if (raw == null || raw == JSONObject.NULL) return null;
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            return Double.isFinite(v) ? v : null;
        }
        String s = String.valueOf(raw).trim();
        if (s.isEmpty() || s.equals("-")) return null;
        try {
            double v = Double.parseDouble(s);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String text(Object raw) {
        if (raw == null || raw == JSONObject.NULL) return null;
        String s = String.valueOf(raw).trim();
        return s.isEmpty() ? null : s;
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }
}
