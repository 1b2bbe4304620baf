package org.gridiron.lineup;

/**
 * Typed outcomes a lineup solve can report. Severity decides whether the issue lands in
 * {@link LineupResult#errors()} or {@link LineupResult#warnings()}.
 */
public enum LineupFailure {
    ROSTER_PARSE_FAILURE(Severity.ERROR),
    SETTINGS_UNAVAILABLE(Severity.WARNING),
    SLOT_UNFILLABLE(Severity.ERROR),
    FALLBACK_PLAYER(Severity.WARNING),
    INVALID_STRATEGY(Severity.ERROR),
    UNEXPECTED_FAILURE(Severity.ERROR);

    public enum Severity { ERROR, WARNING }

    private final Severity severity;

    LineupFailure(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
