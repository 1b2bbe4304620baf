package org.gridiron.service;

import org.gridiron.lineup.ScoringConstants;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rates matchups from a league-wide projection set: how many points a defense is projected to
 * allow to a position, relative to what that position averages against everybody.
 *
 * <p>A ratio of 1.0 maps to the neutral 5.0, every 10% above or below moves the score one step,
 * clamped to 1-10.
 */
public class MatchupRater {

    public record ProjectionRow(String position, String opponent, double points) {}

    public record Rating(double score, String description) {}

    private final Map<String, Double> positionAverages = new HashMap<>();
    private final Map<String, Double> allowedAverages = new HashMap<>();

    public MatchupRater(List<ProjectionRow> rows) {
        Map<String, double[]> byPosition = new HashMap<>();
        Map<String, double[]> byOpponent = new HashMap<>();
        for (ProjectionRow row : rows) {
            if (row.position() == null || row.opponent() == null) continue;
            accumulate(byPosition, row.position(), row.points());
            accumulate(byOpponent, key(row.opponent(), row.position()), row.points());
        }
        byPosition.forEach((k, v) -> positionAverages.put(k, v[0] / v[1]));
        byOpponent.forEach((k, v) -> allowedAverages.put(k, v[0] / v[1]));
    }

    private static void accumulate(Map<String, double[]> sums, String key, double value) {
        double[] acc = sums.computeIfAbsent(key, k -> new double[2]);
        acc[0] += value;
        acc[1] += 1;
    }

    private static String key(String opponent, String position) {
        return opponent.toUpperCase(Locale.ROOT) + "|" + position.toUpperCase(Locale.ROOT);
    }

    /** Null when the opponent or the position is unknown to the projection set. */
    public Rating rate(String position, String opponent) {
        if (position == null || opponent == null) return null;
        Double average = positionAverages.get(position.toUpperCase(Locale.ROOT));
        Double allowed = allowedAverages.get(key(opponent, position));
        if (average == null || allowed == null || average <= 0) return null;

        double ratio = allowed / average;
        double raw = ScoringConstants.MATCHUP_NEUTRAL + (ratio - 1.0) * 10.0;
        double score = Math.round(Math.max(ScoringConstants.MATCHUP_MIN, Math.min(ScoringConstants.MATCHUP_MAX, raw)) * 10.0) / 10.0;

        String label;
        if (score >= 7.0) label = "Favorable";
        else if (score <= 3.5) label = "Tough";
        else label = "Neutral";
        String description = String.format(Locale.ROOT, "%s vs %s (%+.0f%% %s pts allowed)",
                label, opponent.toUpperCase(Locale.ROOT), (ratio - 1.0) * 100.0, position.toUpperCase(Locale.ROOT));
        return new Rating(score, description);
    }
}
