package org.gridiron.lineup;

import java.util.Locale;
import java.util.Objects;

/**
 * A rostered player with every signal the optimizer can use. Instances are immutable;
 * enrichment produces a modified copy through {@link #toBuilder()}.
 */
public final class Player {

    // --- IDENTITY ---
    private final String playerKey;     // provider key, e.g. "423.p.33393"
    private final String name;
    private final String team;          // team abbreviation, e.g. "KC"
    private final String position;      // primary position
    private final String opponent;

    // --- PROVIDER STATE ---
    private final String selectedPosition; // slot currently occupied on the provider roster ("BN", "WR"...)
    private final String injuryStatus;     // "Q", "D", "O", "IR"...

    // --- SIGNALS ---
    private final Double projectionA;   // primary source (Yahoo projected points)
    private final Double projectionB;   // secondary source (Sleeper)
    private final int trendingScore;    // adds over the lookback window
    private final Double matchupScore;  // 1-10, higher = easier
    private final String matchupDescription;
    private final Double floorProjection;
    private final Double ceilingProjection;

    private Player(Builder b) {
        this.playerKey = b.playerKey;
        this.name = b.name;
        this.team = b.team;
        this.position = b.position;
        this.opponent = b.opponent;
        this.selectedPosition = b.selectedPosition;
        this.injuryStatus = b.injuryStatus;
        this.projectionA = b.projectionA;
        this.projectionB = b.projectionB;
        this.trendingScore = Math.max(0, b.trendingScore);
        this.matchupScore = b.matchupScore;
        this.matchupDescription = b.matchupDescription;
        this.floorProjection = b.floorProjection;
        this.ceilingProjection = b.ceilingProjection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.playerKey = playerKey;
        b.name = name;
        b.team = team;
        b.position = position;
        b.opponent = opponent;
        b.selectedPosition = selectedPosition;
        b.injuryStatus = injuryStatus;
        b.projectionA = projectionA;
        b.projectionB = projectionB;
        b.trendingScore = trendingScore;
        b.matchupScore = matchupScore;
        b.matchupDescription = matchupDescription;
        b.floorProjection = floorProjection;
        b.ceilingProjection = ceilingProjection;
        return b;
    }

    public String getPlayerKey() { return playerKey; }
    public String getName() { return name; }
    public String getTeam() { return team; }
    public String getPosition() { return position; }
    public String getOpponent() { return opponent; }
    public String getSelectedPosition() { return selectedPosition; }
    public String getInjuryStatus() { return injuryStatus; }
    public Double getProjectionA() { return projectionA; }
    public Double getProjectionB() { return projectionB; }
    public int getTrendingScore() { return trendingScore; }
    public Double getMatchupScore() { return matchupScore; }
    public String getMatchupDescription() { return matchupDescription; }
    public Double getFloorProjection() { return floorProjection; }
    public Double getCeilingProjection() { return ceilingProjection; }

    public boolean hasProjection() {
        return projectionA != null || projectionB != null;
    }

    public boolean hasMatchupData() {
        return matchupScore != null;
    }

    /** Mean of the available projection sources, or null when neither is present. */
    public Double projectionBasis() {
        if (projectionA != null && projectionB != null) return (projectionA + projectionB) / 2.0;
        if (projectionA != null) return projectionA;
        return projectionB;
    }

    public boolean isOnProviderBench() {
        return selectedPosition == null || "BN".equalsIgnoreCase(selectedPosition)
                || selectedPosition.toUpperCase(Locale.ROOT).startsWith("IR");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        Player other = (Player) o;
        return trendingScore == other.trendingScore
                && Objects.equals(playerKey, other.playerKey)
                && Objects.equals(name, other.name)
                && Objects.equals(team, other.team)
                && Objects.equals(position, other.position)
                && Objects.equals(opponent, other.opponent)
                && Objects.equals(selectedPosition, other.selectedPosition)
                && Objects.equals(injuryStatus, other.injuryStatus)
                && Objects.equals(projectionA, other.projectionA)
                && Objects.equals(projectionB, other.projectionB)
                && Objects.equals(matchupScore, other.matchupScore)
                && Objects.equals(matchupDescription, other.matchupDescription)
                && Objects.equals(floorProjection, other.floorProjection)
                && Objects.equals(ceilingProjection, other.ceilingProjection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(playerKey, name, team, position, projectionA, projectionB);
    }

    @Override
    public String toString() {
        return name + " (" + position + ", " + team + ")";
    }

    public static final class Builder {
        private String playerKey;
        private String name;
        private String team;
        private String position;
        private String opponent;
        private String selectedPosition;
        private String injuryStatus;
        private Double projectionA;
        private Double projectionB;
        private int trendingScore;
        private Double matchupScore;
        private String matchupDescription;
        private Double floorProjection;
        private Double ceilingProjection;

        private Builder() {}

        public Builder playerKey(String playerKey) { this.playerKey = playerKey; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder team(String team) { this.team = team; return this; }
        public Builder position(String position) { this.position = position; return this; }
        public Builder opponent(String opponent) { this.opponent = opponent; return this; }
        public Builder selectedPosition(String selectedPosition) { this.selectedPosition = selectedPosition; return this; }
        public Builder injuryStatus(String injuryStatus) { this.injuryStatus = injuryStatus; return this; }
        public Builder projectionA(Double projectionA) { this.projectionA = projectionA; return this; }
        public Builder projectionB(Double projectionB) { this.projectionB = projectionB; return this; }
        public Builder trendingScore(int trendingScore) { this.trendingScore = trendingScore; return this; }
        public Builder matchupScore(Double matchupScore) { this.matchupScore = matchupScore; return this; }
        public Builder matchupDescription(String matchupDescription) { this.matchupDescription = matchupDescription; return this; }
        public Builder floorProjection(Double floorProjection) { this.floorProjection = floorProjection; return this; }
        public Builder ceilingProjection(Double ceilingProjection) { this.ceilingProjection = ceilingProjection; return this; }

        public Player build() {
            return new Player(this);
        }
    }
}
