package org.gridiron.lineup;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A required lineup position. {@code eligiblePositions} holds the primary positions allowed to fill it.
 */
public record Slot(String code, int count, Set<String> eligiblePositions) {

    public Slot {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Slot code is required");
        }
        if (count < 1) {
            throw new IllegalArgumentException("Slot " + code + " needs a positive count, got " + count);
        }
        if (eligiblePositions == null || eligiblePositions.isEmpty()) {
            throw new IllegalArgumentException("Slot " + code + " has no eligible positions");
        }
        eligiblePositions = Collections.unmodifiableSet(new LinkedHashSet<>(eligiblePositions));
    }

    public boolean accepts(String position) {
        return position != null && eligiblePositions.contains(position);
    }

    /** Size of the eligible set; 1 is the most specific a slot can be. */
    public int specificity() {
        return eligiblePositions.size();
    }

    /** Display label of the n-th instance (1-based): {@code QB}, or {@code WR1}, {@code WR2}... */
    public String label(int index) {
        return count == 1 ? code : code + index;
    }
}
