package org.gridiron.lineup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Data-quality counters and advisory recommendations. Nothing here changes the solver's result.
 */
public final class LineupDiagnostics {

    private LineupDiagnostics() {}

    private static final Set<String> INJURY_DESIGNATIONS = Set.of("Q", "D", "O", "IR", "PUP-R", "PUP-P", "SUSP", "NFI-R");

    public static DataQuality dataQuality(int totalSeen, List<Player> validPlayers) {
        int withProjection = 0;
        int withMatchup = 0;
        for (Player p : validPlayers) {
            if (p.hasProjection()) withProjection++;
            if (p.hasMatchupData()) withMatchup++;
        }
        return new DataQuality(Math.max(totalSeen, validPlayers.size()), validPlayers.size(), withProjection, withMatchup);
    }

    /**
     * Swap suggestions first (largest gain first, capped), then injury notes on starters, then the
     * moves needed to turn the provider's current lineup into the optimized one.
     */
    public static List<String> recommendations(LineupSolver.Assignment assignment) {
        List<String> out = new ArrayList<>(swapSuggestions(assignment));
        out.addAll(injuryNotes(assignment.starters()));
        out.addAll(lineupChanges(assignment));
        return out;
    }

    private record Swap(ScoredPlayer benchPlayer, String label, ScoredPlayer starter, double delta) {}

    static List<String> swapSuggestions(LineupSolver.Assignment assignment) {
        List<Swap> swaps = new ArrayList<>();
        for (ScoredPlayer benchPlayer : assignment.bench()) {
            if (!benchPlayer.isScored()) continue;

            String weakestLabel = null;
            ScoredPlayer weakest = null;
            for (Map.Entry<String, ScoredPlayer> e : assignment.starters().entrySet()) {
                Slot slot = assignment.slotsByLabel().get(e.getKey());
                if (slot == null || !slot.accepts(benchPlayer.position())) continue;
                if (weakest == null || e.getValue().scoreOrMin() < weakest.scoreOrMin()) {
                    weakest = e.getValue();
                    weakestLabel = e.getKey();
                }
            }
            if (weakest == null) continue;

            double delta = benchPlayer.compositeScore() - weakest.scoreOrMin();
            if (delta > ScoringConstants.RECOMMENDATION_MARGIN) {
                swaps.add(new Swap(benchPlayer, weakestLabel, weakest, delta));
            }
        }
        swaps.sort(Comparator.comparingDouble(Swap::delta).reversed()
                .thenComparing(s -> s.benchPlayer().name()));

        List<String> out = new ArrayList<>();
        for (Swap swap : swaps.subList(0, Math.min(swaps.size(), ScoringConstants.MAX_RECOMMENDATIONS))) {
            out.add(describe(swap));
        }
        return out;
    }

    private static String describe(Swap swap) {
        StringBuilder sb = new StringBuilder();
        sb.append("Consider starting ").append(swap.benchPlayer().name())
          .append(" (").append(swap.benchPlayer().position()).append(") over ")
          .append(swap.starter().name()).append(" at ").append(swap.label()).append(": ");
        if (swap.starter().isScored()) {
            sb.append(String.format(Locale.ROOT, "+%.1f composite", swap.delta()));
        } else {
            sb.append("the current starter has no projection data");
        }
        Double benchMatchup = swap.benchPlayer().player().getMatchupScore();
        Double starterMatchup = swap.starter().player().getMatchupScore();
        if (benchMatchup != null && (starterMatchup == null || benchMatchup - starterMatchup >= ScoringConstants.STRONGER_MATCHUP_GAP)) {
            sb.append(", stronger matchup");
            String desc = swap.benchPlayer().player().getMatchupDescription();
            if (desc != null) sb.append(" (").append(desc).append(")");
        }
        return sb.toString();
    }

    static List<String> injuryNotes(Map<String, ScoredPlayer> starters) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ScoredPlayer> e : starters.entrySet()) {
            String status = e.getValue().player().getInjuryStatus();
            if (status != null && INJURY_DESIGNATIONS.contains(status.toUpperCase(Locale.ROOT))) {
                out.add("Check " + e.getValue().name() + " (" + e.getKey() + ") before kickoff: listed as " + status);
            }
        }
        return out;
    }

    static List<String> lineupChanges(LineupSolver.Assignment assignment) {
        List<String> out = new ArrayList<>();
        // Only meaningful when the provider told us where players currently sit.
        boolean known = assignment.starters().values().stream().anyMatch(sp -> sp.player().getSelectedPosition() != null)
                || assignment.bench().stream().anyMatch(sp -> sp.player().getSelectedPosition() != null);
        if (!known) return out;

        List<ScoredPlayer> displaced = new ArrayList<>();
        for (ScoredPlayer sp : assignment.bench()) {
            if (!sp.player().isOnProviderBench()) displaced.add(sp);
        }
        // weakest first, so each promotion is paired with the least valuable current starter
        displaced.sort(Comparator.comparingDouble(ScoredPlayer::scoreOrMin).thenComparing(ScoredPlayer::name));

        for (Map.Entry<String, ScoredPlayer> e : assignment.starters().entrySet()) {
            ScoredPlayer promoted = e.getValue();
            if (!promoted.player().isOnProviderBench()) continue;
            String from = promoted.player().getSelectedPosition() == null ? "BN" : promoted.player().getSelectedPosition();
            Slot slot = assignment.slotsByLabel().get(e.getKey());

            ScoredPlayer replaced = null;
            for (ScoredPlayer candidate : displaced) {
                if (slot != null && slot.accepts(candidate.position())) {
                    replaced = candidate;
                    break;
                }
            }
            StringBuilder sb = new StringBuilder("Start ").append(promoted.name())
                    .append(" at ").append(e.getKey()).append(" (currently ").append(from).append(")");
            if (replaced != null) {
                displaced.remove(replaced);
                sb.append(" instead of ").append(replaced.name());
                if (promoted.isScored() && replaced.isScored()) {
                    sb.append(String.format(Locale.ROOT, ": +%.1f composite", promoted.compositeScore() - replaced.compositeScore()));
                }
            }
            out.add(sb.toString());
        }
        for (ScoredPlayer sp : displaced) {
            out.add("Bench " + sp.name() + " (currently " + sp.player().getSelectedPosition() + ")");
        }
        return out;
    }
}
