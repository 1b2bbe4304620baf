package org.gridiron.lineup;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Builders shared by the lineup tests. */
final class TestPlayers {

    private TestPlayers() {}

    static Player player(String name, String position, Double projection) {
        return Player.builder().name(name).team("TM").position(position).projectionA(projection).build();
    }

    static Player.Builder builder(String name, String position) {
        return Player.builder().name(name).team("TM").position(position);
    }

    static ScoredPlayer scored(String name, String position, Double score) {
        return new ScoredPlayer(player(name, position, score), score, score == null ? Tier.UNKNOWN : Tier.SOLID);
    }

    static Slot slot(String code, int count, String... eligible) {
        return new Slot(code, count, Set.of(eligible));
    }

    static List<Slot> slots(String... codes) {
        List<RosterPosition> positions = new ArrayList<>();
        for (String code : codes) positions.add(new RosterPosition(code, 1));
        return SlotTemplate.fromRosterPositions(positions);
    }
}
