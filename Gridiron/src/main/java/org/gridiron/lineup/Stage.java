package org.gridiron.lineup;

/**
 * Pipeline step, reported with every issue so failures are actionable.
 */
public enum Stage {
    VALIDATE_STRATEGY,
    NORMALIZE_ROSTER,
    EXTRACT_SETTINGS,
    ENRICH,
    SCORE,
    SOLVE,
    DIAGNOSE
}
