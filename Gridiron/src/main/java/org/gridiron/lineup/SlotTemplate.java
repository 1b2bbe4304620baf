package org.gridiron.lineup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link Slot}s from extracted roster positions and knows which primary positions each
 * Yahoo slot code accepts.
 */
public final class SlotTemplate {

    private SlotTemplate() {}

    /** Codes that never start: bench, injured reserve, not active. */
    private static final Set<String> NON_STARTING = Set.of("BN", "IR", "IR+", "NA");

    private static final Map<String, Set<String>> ELIGIBILITY = Map.ofEntries(
            Map.entry("QB", Set.of("QB")),
            Map.entry("RB", Set.of("RB")),
            Map.entry("WR", Set.of("WR")),
            Map.entry("TE", Set.of("TE")),
            Map.entry("K", Set.of("K")),
            Map.entry("DEF", Set.of("DEF")),
            Map.entry("D/ST", Set.of("DEF")),
            Map.entry("W/R/T", Set.of("WR", "RB", "TE")),
            Map.entry("FLEX", Set.of("WR", "RB", "TE")),
            Map.entry("W/R", Set.of("WR", "RB")),
            Map.entry("W/T", Set.of("WR", "TE")),
            Map.entry("R/T", Set.of("RB", "TE")),
            Map.entry("Q/W/R/T", Set.of("QB", "WR", "RB", "TE")),
            Map.entry("SUPERFLEX", Set.of("QB", "WR", "RB", "TE")),
            Map.entry("OP", Set.of("QB", "WR", "RB", "TE")),
            // IDP leagues; DL, LB, DB and the other IDP codes fall through to themselves
            Map.entry("D", Set.of("DL", "LB", "DB"))
    );

    private static final List<RosterPosition> DEFAULT_POSITIONS = List.of(
            new RosterPosition("QB", 1),
            new RosterPosition("WR", 2),
            new RosterPosition("RB", 2),
            new RosterPosition("TE", 1),
            new RosterPosition("W/R/T", 1),
            new RosterPosition("K", 1),
            new RosterPosition("DEF", 1)
    );

    /** Standard Yahoo head-to-head template, used when the league settings cannot be read. */
    public static List<Slot> defaultTemplate() {
        return fromRosterPositions(DEFAULT_POSITIONS);
    }

    /**
     * Converts extracted positions into starting slots, dropping non-starting codes and merging
     * repeated codes. Returns an empty list when nothing startable remains.
     */
    public static List<Slot> fromRosterPositions(List<RosterPosition> positions) {
        if (positions == null || positions.isEmpty()) return Collections.emptyList();

        List<String> order = new ArrayList<>();
        Map<String, Integer> counts = new HashMap<>();
        for (RosterPosition rp : positions) {
            if (rp == null || rp.position() == null) continue;
            String code = rp.position().trim().toUpperCase(Locale.ROOT);
            if (code.isEmpty() || NON_STARTING.contains(code)) continue;
            if (!counts.containsKey(code)) order.add(code);
            counts.merge(code, Math.max(1, rp.count()), Integer::sum);
        }

        List<Slot> slots = new ArrayList<>();
        for (String code : order) {
            slots.add(new Slot(code, counts.get(code), eligibleFor(code)));
        }
        return slots;
    }

    public static Set<String> eligibleFor(String code) {
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return ELIGIBILITY.getOrDefault(normalized, Set.of(normalized));
    }
}
