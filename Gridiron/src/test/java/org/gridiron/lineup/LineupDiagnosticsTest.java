package org.gridiron.lineup;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LineupDiagnosticsTest {

    private static final Slot QB = TestPlayers.slot("QB", 1, "QB");

    private static LineupSolver.Assignment assignment(Map<String, ScoredPlayer> starters, Map<String, Slot> slots,
                                                      List<ScoredPlayer> bench) {
        return new LineupSolver.Assignment(LineupStatus.OK, starters, slots, bench, List.of());
    }

    private static ScoredPlayer scored(Player player, double score) {
        return new ScoredPlayer(player, score, Tier.SOLID);
    }

    @Test
    void suggestsClearlyBetterBenchPlayerWithMatchupNote() {
        ScoredPlayer weak = scored(TestPlayers.builder("Weak Arm", "QB").matchupScore(5.0).build(), 10.0);
        ScoredPlayer strong = scored(TestPlayers.builder("Big Arm", "QB").matchupScore(8.0)
                .matchupDescription("Favorable vs NYJ (+30% QB pts allowed)").build(), 14.0);

        List<String> out = LineupDiagnostics.swapSuggestions(assignment(
                Map.of("QB", weak), Map.of("QB", QB), List.of(strong)));

        assertThat(out).containsExactly(
                "Consider starting Big Arm (QB) over Weak Arm at QB: +4.0 composite, stronger matchup "
                        + "(Favorable vs NYJ (+30% QB pts allowed))");
    }

    @Test
    void smallGainIsNotWorthASuggestion() {
        ScoredPlayer starter = scored(TestPlayers.player("Starter", "QB", null), 10.0);
        ScoredPlayer backup = scored(TestPlayers.player("Backup", "QB", null), 11.2);

        assertThat(LineupDiagnostics.swapSuggestions(assignment(
                Map.of("QB", starter), Map.of("QB", QB), List.of(backup)))).isEmpty();
    }

    @Test
    void ineligibleBenchPlayersAreIgnored() {
        ScoredPlayer starter = scored(TestPlayers.player("Starter", "QB", null), 5.0);
        ScoredPlayer kicker = scored(TestPlayers.player("Kicker", "K", null), 20.0);

        assertThat(LineupDiagnostics.swapSuggestions(assignment(
                Map.of("QB", starter), Map.of("QB", QB), List.of(kicker)))).isEmpty();
    }

    @Test
    void suggestionsAreCappedAndLargestGainFirst() {
        ScoredPlayer starter = scored(TestPlayers.player("Starter", "QB", null), 5.0);
        List<ScoredPlayer> bench = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            bench.add(scored(TestPlayers.player("Backup" + i, "QB", null), 10.0 + i));
        }

        List<String> out = LineupDiagnostics.swapSuggestions(assignment(Map.of("QB", starter), Map.of("QB", QB), bench));

        assertThat(out).hasSize(ScoringConstants.MAX_RECOMMENDATIONS);
        assertThat(out.get(0)).startsWith("Consider starting Backup9 (QB) over Starter at QB: +14.0 composite");
    }

    @Test
    void flagsInjuredStartersOnly() {
        Map<String, ScoredPlayer> starters = new LinkedHashMap<>();
        starters.put("WR1", scored(TestPlayers.builder("Hurt", "WR").injuryStatus("Q").build(), 12.0));
        starters.put("WR2", scored(TestPlayers.builder("Healthy", "WR").build(), 11.0));
        starters.put("RB", scored(TestPlayers.builder("Limited", "RB").injuryStatus("P").build(), 10.0));

        assertThat(LineupDiagnostics.injuryNotes(starters))
                .containsExactly("Check Hurt (WR1) before kickoff: listed as Q");
    }

    @Test
    void describesMovesFromCurrentProviderLineup() {
        ScoredPlayer promoted = scored(TestPlayers.builder("Bench Star", "RB").selectedPosition("BN").build(), 16.0);
        ScoredPlayer demoted = scored(TestPlayers.builder("Old Starter", "RB").selectedPosition("RB").build(), 9.5);
        Slot rb = TestPlayers.slot("RB", 1, "RB");

        List<String> out = LineupDiagnostics.lineupChanges(assignment(
                Map.of("RB", promoted), Map.of("RB", rb), List.of(demoted)));

        assertThat(out).containsExactly("Start Bench Star at RB (currently BN) instead of Old Starter: +6.5 composite");
    }

    @Test
    void unpairedCurrentStarterIsBenched() {
        ScoredPlayer wr = scored(TestPlayers.builder("Receiver", "WR").selectedPosition("WR").build(), 12.0);
        ScoredPlayer extra = scored(TestPlayers.builder("Extra", "TE").selectedPosition("W/R/T").build(), 4.0);
        Slot wrSlot = TestPlayers.slot("WR", 1, "WR");

        List<String> out = LineupDiagnostics.lineupChanges(assignment(
                Map.of("WR", wr), Map.of("WR", wrSlot), List.of(extra)));

        assertThat(out).containsExactly("Bench Extra (currently W/R/T)");
    }

    @Test
    void noMovesWithoutProviderPositions() {
        ScoredPlayer a = scored(TestPlayers.player("A", "QB", 10.0), 10.0);
        ScoredPlayer b = scored(TestPlayers.player("B", "QB", 8.0), 8.0);

        assertThat(LineupDiagnostics.lineupChanges(assignment(Map.of("QB", a), Map.of("QB", QB), List.of(b)))).isEmpty();
    }

    @Test
    void dataQualityCountsSignals() {
        List<Player> players = List.of(
                TestPlayers.builder("A", "QB").projectionA(10.0).matchupScore(6.0).build(),
                TestPlayers.builder("B", "WR").projectionB(7.0).build(),
                TestPlayers.builder("C", "TE").build());

        DataQuality quality = LineupDiagnostics.dataQuality(5, players);

        assertThat(quality).isEqualTo(new DataQuality(5, 3, 2, 1));
    }
}
