package org.gridiron.lineup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal output of one optimization. Always well formed, even when the solve failed.
 *
 * @param starters      slot label to player, in template order; a player appears at most once
 * @param bench         every valid player not starting, best first
 * @param strategyUsed  null only when the requested strategy was rejected
 */
public record LineupResult(
        LineupStatus status,
        Map<String, ScoredPlayer> starters,
        List<ScoredPlayer> bench,
        List<String> recommendations,
        List<LineupIssue> issues,
        DataQuality dataQuality,
        Strategy strategyUsed
) {

    public LineupResult {
        starters = Collections.unmodifiableMap(new LinkedHashMap<>(starters));
        bench = List.copyOf(bench);
        recommendations = List.copyOf(recommendations);
        issues = List.copyOf(issues);
    }

    static LineupResult failure(List<LineupIssue> issues, DataQuality dataQuality, Strategy strategy) {
        return new LineupResult(LineupStatus.ERROR, Map.of(), List.of(), List.of(), issues, dataQuality, strategy);
    }

    public List<String> errors() {
        return issues.stream().filter(LineupIssue::isError).map(LineupIssue::message).collect(Collectors.toList());
    }

    public List<String> warnings() {
        return issues.stream().filter(i -> !i.isError()).map(LineupIssue::message).collect(Collectors.toList());
    }

    public boolean hasIssue(LineupFailure failure) {
        return issues.stream().anyMatch(i -> i.failure() == failure);
    }
}
