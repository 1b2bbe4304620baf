package org.gridiron.lineup;

/**
 * One row of a secondary feed. Every signal is optional; only the identity is required.
 */
public record ExternalProjection(
        String name,
        String team,
        Double projection,
        Double floor,
        Double ceiling,
        Integer trendingAdds,
        String opponent,
        Double matchupScore,
        String matchupDescription
) {

    public PlayerIdentity identity() {
        return PlayerIdentity.of(name, team);
    }
}
