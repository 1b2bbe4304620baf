package org.gridiron.lineup;

import java.util.Locale;

/**
 * Join key between the provider roster and secondary feeds: name + team, trimmed, lower-cased,
 * inner whitespace collapsed.
 */
public record PlayerIdentity(String name, String team) {

    public static PlayerIdentity of(String name, String team) {
        return new PlayerIdentity(normalize(name), normalize(team));
    }

    public static PlayerIdentity of(Player player) {
        return of(player.getName(), player.getTeam());
    }

    static String normalize(String value) {
        if (value == null) return "";
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
