package org.gridiron.lineup;

public enum Tier {
    ELITE, SOLID, FLEX, BENCH,
    /** Not enough signal to compute a composite score. Never folded into BENCH. */
    UNKNOWN
}
