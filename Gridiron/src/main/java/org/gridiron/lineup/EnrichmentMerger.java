package org.gridiron.lineup;

import java.util.List;

/**
 * Folds secondary feeds into normalized players. Implementations must keep size and order of
 * the input and must not touch primary-source fields.
 */
public interface EnrichmentMerger {

    List<Player> merge(List<Player> players, List<EnrichmentFeed> feeds);
}
