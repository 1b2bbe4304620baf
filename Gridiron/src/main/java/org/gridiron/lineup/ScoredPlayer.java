package org.gridiron.lineup;

/**
 * A player annotated for one strategy. {@code compositeScore} is null when the player has no
 * projection-like signal, in which case the tier is {@link Tier#UNKNOWN}.
 */
public record ScoredPlayer(Player player, Double compositeScore, Tier tier) {

    public boolean isScored() {
        return compositeScore != null;
    }

    /** Score used for comparisons; unscored players sort below every scored one. */
    public double scoreOrMin() {
        return compositeScore == null ? Double.NEGATIVE_INFINITY : compositeScore;
    }

    public String name() {
        return player.getName();
    }

    public String position() {
        return player.getPosition();
    }
}
