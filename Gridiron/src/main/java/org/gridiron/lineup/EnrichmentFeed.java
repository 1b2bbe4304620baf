package org.gridiron.lineup;

import java.util.Collections;
import java.util.List;

/**
 * A named secondary data source (e.g. "sleeper") ready to be merged into the roster.
 */
public record EnrichmentFeed(String source, List<ExternalProjection> entries) {

    public EnrichmentFeed {
        entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
    }

    public static EnrichmentFeed empty(String source) {
        return new EnrichmentFeed(source, Collections.emptyList());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
