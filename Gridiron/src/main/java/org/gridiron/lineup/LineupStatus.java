package org.gridiron.lineup;

import java.util.Locale;

public enum LineupStatus {
    /** Every slot filled, nothing to report. */
    OK,
    /** Every slot filled, with warnings (fallback starter, default template...). */
    OK_WITH_WARNINGS,
    ERROR;

    public boolean isOk() {
        return this != ERROR;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
