package org.gridiron.lineup;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TierClassifierTest {

    @Test
    void tiersFollowStandingWithinPosition() {
        List<Player> receivers = new ArrayList<>();
        for (int i = 10; i >= 1; i--) {
            receivers.add(TestPlayers.player("WR" + i, "WR", (double) i));
        }

        List<ScoredPlayer> scored = TierClassifier.classify(receivers, Strategy.BALANCED);

        assertThat(scored).extracting(ScoredPlayer::tier).containsExactly(
                Tier.ELITE, Tier.SOLID, Tier.SOLID, Tier.SOLID,
                Tier.FLEX, Tier.FLEX, Tier.FLEX,
                Tier.BENCH, Tier.BENCH, Tier.BENCH);
    }

    @Test
    void positionsAreRankedSeparately() {
        List<ScoredPlayer> scored = TierClassifier.classify(List.of(
                TestPlayers.player("Kicker", "K", 8.0),
                TestPlayers.player("QB1", "QB", 25.0),
                TestPlayers.player("QB2", "QB", 18.0)), Strategy.BALANCED);

        assertThat(scored.get(0).tier()).isEqualTo(Tier.ELITE);
        assertThat(scored.get(1).tier()).isEqualTo(Tier.ELITE);
        assertThat(scored.get(2).tier()).isEqualTo(Tier.FLEX);
    }

    @Test
    void equalScoresShareTier() {
        List<ScoredPlayer> scored = TierClassifier.classify(List.of(
                TestPlayers.player("A", "RB", 14.0),
                TestPlayers.player("B", "RB", 14.0),
                TestPlayers.player("C", "RB", 6.0)), Strategy.BALANCED);

        assertThat(scored.get(0).tier()).isEqualTo(Tier.ELITE);
        assertThat(scored.get(1).tier()).isEqualTo(Tier.ELITE);
    }

    @Test
    void unscoredPlayersAreUnknownAndDoNotCountInGroup() {
        List<ScoredPlayer> scored = TierClassifier.classify(List.of(
                TestPlayers.player("NoData", "TE", null),
                TestPlayers.player("Only", "TE", 3.0)), Strategy.FLOOR);

        assertThat(scored.get(0).tier()).isEqualTo(Tier.UNKNOWN);
        assertThat(scored.get(0).compositeScore()).isNull();
        assertThat(scored.get(1).tier()).isEqualTo(Tier.ELITE);
    }

    @Test
    void keepsInputOrder() {
        List<Player> players = List.of(
                TestPlayers.player("Low", "WR", 2.0),
                TestPlayers.player("High", "WR", 20.0));

        assertThat(TierClassifier.classify(players, Strategy.CEILING))
                .extracting(ScoredPlayer::name).containsExactly("Low", "High");
    }
}
