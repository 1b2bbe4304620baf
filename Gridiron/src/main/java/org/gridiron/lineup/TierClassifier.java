package org.gridiron.lineup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scores a whole pool for one strategy and buckets every player by standing within its
 * position group. Standing is the share of scored group members with a strictly higher score,
 * so equal scores always share a tier.
 */
public final class TierClassifier {

    private TierClassifier() {}

    /** Returns one {@link ScoredPlayer} per input player, in input order. */
    public static List<ScoredPlayer> classify(List<Player> players, Strategy strategy) {
        List<Double> scores = new ArrayList<>(players.size());
        Map<String, List<Double>> byPosition = new HashMap<>();

        for (Player player : players) {
            OptionalDouble score = CompositeScorer.score(player, strategy);
            Double value = score.isPresent() ? score.getAsDouble() : null;
            scores.add(value);
            if (value != null) {
                byPosition.computeIfAbsent(player.getPosition(), k -> new ArrayList<>()).add(value);
            }
        }

        List<ScoredPlayer> scored = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            Double value = scores.get(i);
            Tier tier = value == null ? Tier.UNKNOWN : tierFor(value, byPosition.get(player.getPosition()));
            scored.add(new ScoredPlayer(player, value, tier));
        }
        return scored;
    }

    static Tier tierFor(double score, List<Double> group) {
        long higher = group.stream().filter(other -> other > score).count();
        double standing = (double) higher / group.size();
        if (standing < ScoringConstants.Tiers.ELITE_CUTOFF) return Tier.ELITE;
        if (standing < ScoringConstants.Tiers.SOLID_CUTOFF) return Tier.SOLID;
        if (standing < ScoringConstants.Tiers.FLEX_CUTOFF) return Tier.FLEX;
        return Tier.BENCH;
    }
}
