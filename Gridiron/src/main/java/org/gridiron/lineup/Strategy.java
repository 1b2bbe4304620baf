package org.gridiron.lineup;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Objective used to rank players: even weighting, safety (floor) or upside (ceiling).
 */
public enum Strategy {

    BALANCED(ScoringConstants.Balanced.PROJECTION_A_WEIGHT, ScoringConstants.Balanced.PROJECTION_B_WEIGHT,
            ScoringConstants.Balanced.FLOOR_WEIGHT, ScoringConstants.Balanced.CEILING_WEIGHT,
            ScoringConstants.Balanced.MATCHUP_POINTS_PER_STEP, ScoringConstants.Balanced.TRENDING_POINTS_PER_LOG),
    FLOOR(ScoringConstants.Floor.PROJECTION_A_WEIGHT, ScoringConstants.Floor.PROJECTION_B_WEIGHT,
            ScoringConstants.Floor.FLOOR_WEIGHT, ScoringConstants.Floor.CEILING_WEIGHT,
            ScoringConstants.Floor.MATCHUP_POINTS_PER_STEP, ScoringConstants.Floor.TRENDING_POINTS_PER_LOG),
    CEILING(ScoringConstants.Ceiling.PROJECTION_A_WEIGHT, ScoringConstants.Ceiling.PROJECTION_B_WEIGHT,
            ScoringConstants.Ceiling.FLOOR_WEIGHT, ScoringConstants.Ceiling.CEILING_WEIGHT,
            ScoringConstants.Ceiling.MATCHUP_POINTS_PER_STEP, ScoringConstants.Ceiling.TRENDING_POINTS_PER_LOG);

    final double projectionAWeight;
    final double projectionBWeight;
    final double floorWeight;
    final double ceilingWeight;
    final double matchupPointsPerStep;
    final double trendingPointsPerLog;

    Strategy(double projectionAWeight, double projectionBWeight, double floorWeight, double ceilingWeight,
             double matchupPointsPerStep, double trendingPointsPerLog) {
        this.projectionAWeight = projectionAWeight;
        this.projectionBWeight = projectionBWeight;
        this.floorWeight = floorWeight;
        this.ceilingWeight = ceilingWeight;
        this.matchupPointsPerStep = matchupPointsPerStep;
        this.trendingPointsPerLog = trendingPointsPerLog;
    }

    /** Lower-case name as used by the tool arguments ("balanced", "floor", "ceiling"). */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a caller supplied strategy name. Never defaults: anything unrecognized is rejected.
     *
     * @throws InvalidStrategyException if the value is null, blank or unknown
     */
    public static Strategy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidStrategyException(raw, allowedValues());
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "balanced" -> BALANCED;
            case "floor" -> FLOOR;
            case "ceiling" -> CEILING;
            default -> throw new InvalidStrategyException(raw, allowedValues());
        };
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(Strategy::key).collect(Collectors.joining(", "));
    }
}
