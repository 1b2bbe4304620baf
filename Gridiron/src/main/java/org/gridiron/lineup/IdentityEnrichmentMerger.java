package org.gridiron.lineup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches feed rows to players by {@link PlayerIdentity}. Feeds are applied in the given order and
 * the first feed supplying a field wins. Unmatched players pass through unchanged.
 *
 * <p>After merging, floor and ceiling are reconciled so that
 * {@code floor <= projection basis <= ceiling} holds whenever all three are known.
 */
public class IdentityEnrichmentMerger implements EnrichmentMerger {

    private static final Logger log = LoggerFactory.getLogger(IdentityEnrichmentMerger.class);

    @Override
    public List<Player> merge(List<Player> players, List<EnrichmentFeed> feeds) {
        List<Player> merged = new ArrayList<>(players.size());
        List<Map<PlayerIdentity, ExternalProjection>> indexes = new ArrayList<>();
        if (feeds != null) {
            for (EnrichmentFeed feed : feeds) {
                if (feed != null && !feed.isEmpty()) indexes.add(index(feed));
            }
        }

        int matched = 0;
        for (Player player : players) {
            PlayerIdentity identity = PlayerIdentity.of(player);
            Player.Builder builder = player.toBuilder();
            Player current = player;
            boolean hit = false;
            for (Map<PlayerIdentity, ExternalProjection> index : indexes) {
                ExternalProjection row = index.get(identity);
                if (row == null) continue;
                hit = true;
                apply(current, row, builder);
                current = builder.build();
            }
            if (hit) matched++;
            merged.add(reconcileBounds(current));
        }
        log.debug("Enrichment matched {} of {} players across {} feed(s)", matched, players.size(), indexes.size());
        return merged;
    }

    private static Map<PlayerIdentity, ExternalProjection> index(EnrichmentFeed feed) {
        Map<PlayerIdentity, ExternalProjection> byIdentity = new HashMap<>();
        for (ExternalProjection row : feed.entries()) {
            if (row == null || row.name() == null) continue;
            byIdentity.putIfAbsent(row.identity(), row);
        }
        return byIdentity;
    }

    // Only secondary fields, and only when still empty.
    private static void apply(Player current, ExternalProjection row, Player.Builder builder) {
        if (current.getProjectionB() == null && row.projection() != null) builder.projectionB(row.projection());
        if (current.getFloorProjection() == null && row.floor() != null) builder.floorProjection(row.floor());
        if (current.getCeilingProjection() == null && row.ceiling() != null) builder.ceilingProjection(row.ceiling());
        if (current.getTrendingScore() == 0 && row.trendingAdds() != null) builder.trendingScore(row.trendingAdds());
        if (current.getOpponent() == null && row.opponent() != null) builder.opponent(row.opponent());
        if (current.getMatchupScore() == null && row.matchupScore() != null) {
            builder.matchupScore(row.matchupScore());
            builder.matchupDescription(row.matchupDescription());
        }
    }

    static Player reconcileBounds(Player player) {
        Double floor = player.getFloorProjection();
        Double ceiling = player.getCeilingProjection();
        if (floor == null && ceiling == null) return player;

        if (floor != null && ceiling != null && floor > ceiling) {
            double tmp = floor;
            floor = ceiling;
            ceiling = tmp;
        }
        Double basis = player.projectionBasis();
        if (basis != null) {
            if (floor != null && floor > basis) floor = basis;
            if (ceiling != null && ceiling < basis) ceiling = basis;
        }
        if (Objects.equals(floor, player.getFloorProjection()) && Objects.equals(ceiling, player.getCeilingProjection())) {
            return player;
        }
        return player.toBuilder().floorProjection(floor).ceilingProjection(ceiling).build();
    }
}
