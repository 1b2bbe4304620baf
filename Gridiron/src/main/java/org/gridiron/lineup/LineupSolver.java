package org.gridiron.lineup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Greedy, specificity-first slot filler.
 *
 * <p>Slot instances are filled from the narrowest eligible set to the widest so that a FLEX-like
 * slot never takes the only candidate of a dedicated slot. Each instance takes the best remaining
 * eligible player under {@link #ranking(Strategy)}. This is not a joint optimum (that would need
 * weighted bipartite matching) but with at most a dozen slots it lands on it in practice.
 */
public final class LineupSolver {

    private LineupSolver() {}

    /** Solver output before diagnostics. {@code starters} is keyed by slot label in template order. */
    public record Assignment(
            LineupStatus status,
            Map<String, ScoredPlayer> starters,
            Map<String, Slot> slotsByLabel,
            List<ScoredPlayer> bench,
            List<LineupIssue> issues
    ) {}

    private record SlotInstance(Slot slot, String label, int templateOrder, int index) {}

    public static Assignment solve(List<ScoredPlayer> pool, List<Slot> slots, Strategy strategy) {
        List<LineupIssue> issues = new ArrayList<>();
        if (pool == null || pool.isEmpty()) {
            issues.add(new LineupIssue(LineupFailure.ROSTER_PARSE_FAILURE, Stage.SOLVE, "No valid players to assign"));
            return new Assignment(LineupStatus.ERROR, new LinkedHashMap<>(), new LinkedHashMap<>(), List.of(), issues);
        }

        List<SlotInstance> instances = expand(slots);
        List<SlotInstance> fillOrder = new ArrayList<>(instances);
        fillOrder.sort(Comparator.comparingInt((SlotInstance si) -> si.slot().specificity())
                .thenComparingInt(SlotInstance::templateOrder)
                .thenComparingInt(SlotInstance::index));

        Comparator<ScoredPlayer> ranking = ranking(strategy);
        boolean[] assigned = new boolean[pool.size()];
        Map<String, ScoredPlayer> chosen = new LinkedHashMap<>();
        boolean structuralError = false;

        for (SlotInstance instance : fillOrder) {
            Optional<Integer> pick = bestCandidate(pool, assigned, instance.slot(), ranking);
            if (pick.isEmpty()) {
                structuralError = true;
                issues.add(new LineupIssue(LineupFailure.SLOT_UNFILLABLE, Stage.SOLVE, unfillableMessage(pool, instance)));
                continue;
            }
            int idx = pick.get();
            assigned[idx] = true;
            ScoredPlayer player = pool.get(idx);
            chosen.put(instance.label(), player);
            if (isFallback(player)) {
                issues.add(new LineupIssue(LineupFailure.FALLBACK_PLAYER, Stage.SOLVE, fallbackMessage(player, instance)));
            }
        }

        Map<String, ScoredPlayer> starters = new LinkedHashMap<>();
        Map<String, Slot> slotsByLabel = new LinkedHashMap<>();
        for (SlotInstance instance : instances) {
            slotsByLabel.put(instance.label(), instance.slot());
            ScoredPlayer player = chosen.get(instance.label());
            if (player != null) starters.put(instance.label(), player);
        }

        List<ScoredPlayer> bench = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            if (!assigned[i]) bench.add(pool.get(i));
        }
        bench.sort(ranking);

        LineupStatus status;
        if (structuralError) status = LineupStatus.ERROR;
        else if (issues.stream().anyMatch(issue -> !issue.isError())) status = LineupStatus.OK_WITH_WARNINGS;
        else status = LineupStatus.OK;
        return new Assignment(status, starters, slotsByLabel, bench, issues);
    }

    /**
     * Best first: scored before unscored, composite descending, then the strategy tiebreak
     * (floor projection, ceiling projection or trending adds), then name, team and key.
     */
    public static Comparator<ScoredPlayer> ranking(Strategy strategy) {
        Comparator<ScoredPlayer> byScore = Comparator.comparingDouble(ScoredPlayer::scoreOrMin).reversed();
        Comparator<ScoredPlayer> tiebreak = switch (strategy) {
            case FLOOR -> Comparator.comparing((ScoredPlayer sp) -> sp.player().getFloorProjection(),
                    Comparator.nullsLast(Comparator.reverseOrder()));
            case CEILING -> Comparator.comparing((ScoredPlayer sp) -> sp.player().getCeilingProjection(),
                    Comparator.nullsLast(Comparator.reverseOrder()));
            case BALANCED -> Comparator.comparingInt((ScoredPlayer sp) -> sp.player().getTrendingScore()).reversed();
        };
        return byScore.thenComparing(tiebreak)
                .thenComparing(ScoredPlayer::name, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing((ScoredPlayer sp) -> sp.player().getTeam(), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing((ScoredPlayer sp) -> sp.player().getPlayerKey(), Comparator.nullsLast(Comparator.naturalOrder()));
    }

    static boolean isFallback(ScoredPlayer player) {
        return !player.isScored() || player.compositeScore() < ScoringConstants.FALLBACK_SCORE_THRESHOLD;
    }

    /**
     * One instance per required starter. Labels are numbered across every slot sharing a code,
     * so a template listing {@code WR} twice yields {@code WR1} and {@code WR2}.
     */
    private static List<SlotInstance> expand(List<Slot> slots) {
        Map<String, Integer> totals = new HashMap<>();
        for (Slot slot : slots) totals.merge(slot.code(), slot.count(), Integer::sum);

        Map<String, Integer> seen = new HashMap<>();
        List<SlotInstance> instances = new ArrayList<>();
        for (int order = 0; order < slots.size(); order++) {
            Slot slot = slots.get(order);
            for (int i = 1; i <= slot.count(); i++) {
                int n = seen.merge(slot.code(), 1, Integer::sum);
                String label = totals.get(slot.code()) == 1 ? slot.code() : slot.code() + n;
                instances.add(new SlotInstance(slot, label, order, i));
            }
        }
        return instances;
    }

    private static Optional<Integer> bestCandidate(List<ScoredPlayer> pool, boolean[] assigned, Slot slot,
                                                   Comparator<ScoredPlayer> ranking) {
        Integer best = null;
        for (int i = 0; i < pool.size(); i++) {
            if (assigned[i] || !slot.accepts(pool.get(i).position())) continue;
            if (best == null || ranking.compare(pool.get(i), pool.get(best)) < 0) best = i;
        }
        return Optional.ofNullable(best);
    }

    private static String unfillableMessage(List<ScoredPlayer> pool, SlotInstance instance) {
        boolean anyEligible = pool.stream().anyMatch(sp -> instance.slot().accepts(sp.position()));
        if (!anyEligible) {
            return "No player on the roster is eligible for " + instance.label()
                    + " (needs " + String.join("/", instance.slot().eligiblePositions()) + ")";
        }
        return "Every player eligible for " + instance.label() + " is already starting elsewhere";
    }

    private static String fallbackMessage(ScoredPlayer player, SlotInstance instance) {
        if (!player.isScored()) {
            return instance.label() + " filled by " + player.name() + " without any projection data";
        }
        return String.format(Locale.ROOT, "%s filled by %s with a low composite score (%.1f)",
                instance.label(), player.name(), player.compositeScore());
    }
}
