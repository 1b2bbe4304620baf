package org.gridiron.lineup;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the lineup engine: normalize, extract the slot template, enrich, score and
 * classify, solve, then diagnose.
 *
 * <p>Collaborators are injected so that other providers can plug in their own payload parsers.
 * Every call returns a {@link LineupResult}; unexpected runtime failures are converted into an
 * {@link LineupFailure#UNEXPECTED_FAILURE} issue naming the stage that broke.
 */
public class LineupOptimizer {

    private static final Logger log = LoggerFactory.getLogger(LineupOptimizer.class);

    private final RosterPositionExtractor extractor;
    private final PlayerNormalizer normalizer;
    private final EnrichmentMerger merger;

    public LineupOptimizer(RosterPositionExtractor extractor, PlayerNormalizer normalizer, EnrichmentMerger merger) {
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.merger = merger;
    }

    /** Yahoo parsers and identity-based enrichment. */
    public static LineupOptimizer withDefaults() {
        return new LineupOptimizer(new YahooRosterPositionExtractor(), new YahooPlayerNormalizer(), new IdentityEnrichmentMerger());
    }

    public PlayerNormalizer normalizer() {
        return normalizer;
    }

    // --- FULL PIPELINE ---

    public LineupResult optimize(JSONObject rosterResponse, JSONObject settingsResponse,
                                 List<EnrichmentFeed> feeds, String strategyName) {
        Strategy strategy;
        try {
            strategy = Strategy.parse(strategyName);
        } catch (InvalidStrategyException e) {
            return rejectStrategy(e);
        }

        Stage stage = Stage.NORMALIZE_ROSTER;
        List<LineupIssue> issues = new ArrayList<>();
        try {
            NormalizedRoster roster = normalizer.normalize(rosterResponse);
            if (roster.isEmpty()) {
                return rosterParseFailure(roster.totalSeen(), roster.invalidCount(), strategy);
            }

            stage = Stage.EXTRACT_SETTINGS;
            List<Slot> slots = SlotTemplate.fromRosterPositions(extractor.extract(settingsResponse));
            if (slots.isEmpty()) {
                slots = useDefaultTemplate(issues);
            }

            stage = Stage.ENRICH;
            List<Player> players = merger.merge(roster.players(), feeds == null ? List.of() : feeds);

            return solve(roster.totalSeen(), players, strategy, slots, issues);
        } catch (RuntimeException e) {
            return unexpected(stage, e, strategy);
        }
    }

    // --- PRE-ENRICHED PLAYERS ---

    public LineupResult optimize(List<Player> players, String strategyName, List<Slot> slotTemplate) {
        Strategy strategy;
        try {
            strategy = Strategy.parse(strategyName);
        } catch (InvalidStrategyException e) {
            return rejectStrategy(e);
        }
        return optimize(players, strategy, slotTemplate);
    }

    public LineupResult optimize(List<Player> players, Strategy strategy, List<Slot> slotTemplate) {
        if (strategy == null) {
            return rejectStrategy(new InvalidStrategyException(null, Strategy.allowedValues()));
        }
        int totalSeen = players == null ? 0 : players.size();
        try {
            List<Player> valid = new ArrayList<>();
            if (players != null) {
                for (Player p : players) {
                    if (p != null && p.getName() != null && p.getPosition() != null) valid.add(p);
                }
            }
            if (valid.isEmpty()) {
                return rosterParseFailure(totalSeen, totalSeen, strategy);
            }
            List<LineupIssue> issues = new ArrayList<>();
            List<Slot> slots = slotTemplate;
            if (slots == null || slots.isEmpty()) {
                slots = useDefaultTemplate(issues);
            }
            return solve(totalSeen, valid, strategy, slots, issues);
        } catch (RuntimeException e) {
            return unexpected(Stage.SOLVE, e, strategy);
        }
    }

    // --- SHARED TAIL ---

    private LineupResult solve(int totalSeen, List<Player> players, Strategy strategy, List<Slot> slots,
                               List<LineupIssue> issues) {
        Stage stage = Stage.SCORE;
        try {
            List<ScoredPlayer> scored = TierClassifier.classify(players, strategy);

            stage = Stage.SOLVE;
            LineupSolver.Assignment assignment = LineupSolver.solve(scored, slots, strategy);
            issues.addAll(assignment.issues());

            stage = Stage.DIAGNOSE;
            DataQuality quality = LineupDiagnostics.dataQuality(totalSeen, players);
            List<String> recommendations = LineupDiagnostics.recommendations(assignment);

            LineupStatus status = assignment.status();
            if (status == LineupStatus.OK && !issues.isEmpty()) {
                status = LineupStatus.OK_WITH_WARNINGS;
            }
            log.debug("Lineup solved with {}: {} starters, {} bench, status {}",
                    strategy.key(), assignment.starters().size(), assignment.bench().size(), status);
            return new LineupResult(status, assignment.starters(), assignment.bench(), recommendations,
                    issues, quality, strategy);
        } catch (RuntimeException e) {
            return unexpected(stage, e, strategy);
        }
    }

    private static List<Slot> useDefaultTemplate(List<LineupIssue> issues) {
        issues.add(new LineupIssue(LineupFailure.SETTINGS_UNAVAILABLE, Stage.EXTRACT_SETTINGS,
                "League roster settings unavailable, using the default lineup template"));
        return SlotTemplate.defaultTemplate();
    }

    private static LineupResult rejectStrategy(InvalidStrategyException e) {
        return LineupResult.failure(
                List.of(new LineupIssue(LineupFailure.INVALID_STRATEGY, Stage.VALIDATE_STRATEGY, e.getMessage())),
                DataQuality.empty(0), null);
    }

    private static LineupResult rosterParseFailure(int totalSeen, int invalid, Strategy strategy) {
        String message = "No valid players found in roster (" + totalSeen + " entries seen, " + invalid + " unreadable)";
        return LineupResult.failure(
                List.of(new LineupIssue(LineupFailure.ROSTER_PARSE_FAILURE, Stage.NORMALIZE_ROSTER, message)),
                DataQuality.empty(totalSeen), strategy);
    }

    private static LineupResult unexpected(Stage stage, RuntimeException e, Strategy strategy) {
        log.error("Lineup optimization failed during {}", stage, e);
        String message = "Unexpected failure during " + stage + ": "
                + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        return LineupResult.failure(
                List.of(new LineupIssue(LineupFailure.UNEXPECTED_FAILURE, stage, message)),
                DataQuality.empty(0), strategy);
    }
}
