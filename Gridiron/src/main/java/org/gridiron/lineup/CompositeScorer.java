package org.gridiron.lineup;

import java.util.OptionalDouble;

/**
 * Computes the strategy-dependent composite score of a player.
 *
 * <p>The basis is a weighted average of the projection-like signals that are present
 * (projection A, projection B, floor, ceiling). A missing signal drops out of both numerator and
 * denominator, so a player with one projection source is not penalized against a player with two.
 * Matchup and trending are additive adjustments on top of the basis:
 * <ul>
 *   <li>matchup: {@code (matchupScore - 5) * pointsPerStep}, absent means neutral</li>
 *   <li>trending: {@code log10(1 + adds) * pointsPerLog}, never negative</li>
 * </ul>
 * Without any projection-like signal there is no score at all.
 */
public final class CompositeScorer {

    private CompositeScorer() {}

    public static OptionalDouble score(Player player, Strategy strategy) {
        double weighted = 0.0;
        double totalWeight = 0.0;

        if (player.getProjectionA() != null && strategy.projectionAWeight > 0) {
            weighted += player.getProjectionA() * strategy.projectionAWeight;
            totalWeight += strategy.projectionAWeight;
        }
        if (player.getProjectionB() != null && strategy.projectionBWeight > 0) {
            weighted += player.getProjectionB() * strategy.projectionBWeight;
            totalWeight += strategy.projectionBWeight;
        }
        if (player.getFloorProjection() != null && strategy.floorWeight > 0) {
            weighted += player.getFloorProjection() * strategy.floorWeight;
            totalWeight += strategy.floorWeight;
        }
        if (player.getCeilingProjection() != null && strategy.ceilingWeight > 0) {
            weighted += player.getCeilingProjection() * strategy.ceilingWeight;
            totalWeight += strategy.ceilingWeight;
        }
        if (totalWeight == 0.0) {
            return OptionalDouble.empty();
        }

        double score = weighted / totalWeight;
        score += matchupAdjustment(player.getMatchupScore(), strategy);
        score += trendingAdjustment(player.getTrendingScore(), strategy);
        return OptionalDouble.of(score);
    }

    static double matchupAdjustment(Double matchupScore, Strategy strategy) {
        if (matchupScore == null) return 0.0;
        double clamped = Math.max(ScoringConstants.MATCHUP_MIN, Math.min(ScoringConstants.MATCHUP_MAX, matchupScore));
        return (clamped - ScoringConstants.MATCHUP_NEUTRAL) * strategy.matchupPointsPerStep;
    }

    static double trendingAdjustment(int adds, Strategy strategy) {
        if (adds <= 0) return 0.0;
        return Math.log10(1.0 + adds) * strategy.trendingPointsPerLog;
    }
}
