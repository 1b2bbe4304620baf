package org.gridiron.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchupRaterTest {

    private final MatchupRater rater = new MatchupRater(List.of(
            new MatchupRater.ProjectionRow("RB", "NYJ", 20.0),
            new MatchupRater.ProjectionRow("RB", "NYJ", 20.0),
            new MatchupRater.ProjectionRow("RB", "BUF", 10.0),
            new MatchupRater.ProjectionRow("WR", "BUF", 12.0)));

    @Test
    void softDefenseIsFavorable() {
        MatchupRater.Rating rating = rater.rate("RB", "nyj");

        assertThat(rating.score()).isEqualTo(7.0);
        assertThat(rating.description()).isEqualTo("Favorable vs NYJ (+20% RB pts allowed)");
    }

    @Test
    void stingyDefenseIsToughAndClamped() {
        MatchupRater.Rating rating = rater.rate("RB", "BUF");

        assertThat(rating.score()).isEqualTo(1.0);
        assertThat(rating.description()).startsWith("Tough vs BUF (-40%");
    }

    @Test
    void averageDefenseIsNeutral() {
        MatchupRater.Rating rating = rater.rate("WR", "BUF");

        assertThat(rating.score()).isEqualTo(5.0);
        assertThat(rating.description()).startsWith("Neutral");
    }

    @Test
    void unknownOpponentOrPositionHasNoRating() {
        assertThat(rater.rate("RB", "KC")).isNull();
        assertThat(rater.rate("TE", "NYJ")).isNull();
        assertThat(rater.rate(null, "NYJ")).isNull();
    }
}
