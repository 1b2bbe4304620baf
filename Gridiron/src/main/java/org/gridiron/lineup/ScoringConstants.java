package org.gridiron.lineup;

/**
 * Centralized calibration values for the composite scorer, the tier classifier and the solver.
 * Tuning these changes rankings without touching the scoring logic itself.
 */
public final class ScoringConstants {

    private ScoringConstants() {}

    // --- COMPOSITE SCORE WEIGHTS PER STRATEGY ---
    public static final class Balanced {
        public static final double PROJECTION_A_WEIGHT = 0.40;
        public static final double PROJECTION_B_WEIGHT = 0.40;
        public static final double FLOOR_WEIGHT = 0.10;
        public static final double CEILING_WEIGHT = 0.10;
        public static final double MATCHUP_POINTS_PER_STEP = 0.60;
        public static final double TRENDING_POINTS_PER_LOG = 0.50;
    }

    public static final class Floor {
        public static final double PROJECTION_A_WEIGHT = 0.30;
        public static final double PROJECTION_B_WEIGHT = 0.30;
        public static final double FLOOR_WEIGHT = 0.40;
        public static final double CEILING_WEIGHT = 0.0;
        public static final double MATCHUP_POINTS_PER_STEP = 0.50;
        public static final double TRENDING_POINTS_PER_LOG = 0.20;
    }

    public static final class Ceiling {
        public static final double PROJECTION_A_WEIGHT = 0.30;
        public static final double PROJECTION_B_WEIGHT = 0.30;
        public static final double FLOOR_WEIGHT = 0.0;
        public static final double CEILING_WEIGHT = 0.40;
        public static final double MATCHUP_POINTS_PER_STEP = 0.50;
        // Must stay >= Floor.TRENDING_POINTS_PER_LOG, matchup weight must equal Floor's.
        public static final double TRENDING_POINTS_PER_LOG = 0.80;
    }

    // --- MATCHUP SCALE ---
    public static final double MATCHUP_MIN = 1.0;
    public static final double MATCHUP_MAX = 10.0;
    public static final double MATCHUP_NEUTRAL = 5.0;

    // --- TIERS (share of the position group scoring strictly higher) ---
    public static final class Tiers {
        public static final double ELITE_CUTOFF = 0.10;
        public static final double SOLID_CUTOFF = 0.40;
        public static final double FLEX_CUTOFF = 0.70;
    }

    // --- SOLVER ---
    /** A starter below this composite score is a fallback pick and triggers a warning. */
    public static final double FALLBACK_SCORE_THRESHOLD = 2.0;

    // --- DIAGNOSTICS ---
    public static final double RECOMMENDATION_MARGIN = 1.5;
    public static final int MAX_RECOMMENDATIONS = 8;
    public static final double STRONGER_MATCHUP_GAP = 1.5;
}
