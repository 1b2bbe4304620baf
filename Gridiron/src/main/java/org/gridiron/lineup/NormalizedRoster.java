package org.gridiron.lineup;

import java.util.List;

/**
 * Output of a {@link PlayerNormalizer}: the valid players plus how many raw entries were seen and skipped.
 */
public record NormalizedRoster(List<Player> players, int invalidCount, int totalSeen) {

    public NormalizedRoster {
        players = List.copyOf(players);
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }
}
