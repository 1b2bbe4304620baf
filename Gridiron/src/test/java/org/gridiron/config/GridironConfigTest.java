package org.gridiron.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridironConfigTest {

    private static GridironConfig config(Map<String, String> values) {
        return GridironConfig.fromMap(values, Path.of("test.env"));
    }

    @Test
    void blankValuesCountAsMissing() {
        GridironConfig config = config(Map.of(GridironConfig.MISTRAL_API_KEY, "  ", GridironConfig.YAHOO_CLIENT_ID, " abc "));

        assertThat(config.get(GridironConfig.MISTRAL_API_KEY)).isNull();
        assertThat(config.get(GridironConfig.YAHOO_CLIENT_ID)).isEqualTo("abc");
        assertThat(config.getOrDefault(GridironConfig.MISTRAL_API_KEY, "none")).isEqualTo("none");
    }

    @Test
    void requireNamesTheMissingKeyAndFile() {
        assertThatThrownBy(() -> config(Map.of()).require(GridironConfig.YAHOO_CLIENT_SECRET))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("YAHOO_CLIENT_SECRET")
                .hasMessageContaining("test.env");
    }

    @Test
    void sleeperScoringDefaultsToHalfPpr() {
        assertThat(config(Map.of()).sleeperScoring()).isEqualTo("pts_half_ppr");
        assertThat(config(Map.of(GridironConfig.SLEEPER_SCORING, "pts_ppr")).sleeperScoring()).isEqualTo("pts_ppr");
    }

    @Test
    void seasonComesFromConfigOrCalendar() {
        assertThat(config(Map.of(GridironConfig.NFL_SEASON, "2024")).season()).isEqualTo(2024);

        LocalDate today = LocalDate.now();
        int expected = today.getMonthValue() < 3 ? today.getYear() - 1 : today.getYear();
        assertThat(config(Map.of()).season()).isEqualTo(expected);
    }

    @Test
    void nonNumericSeasonIsRejected() {
        assertThatThrownBy(() -> config(Map.of(GridironConfig.NFL_SEASON, "next")).season())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NFL_SEASON");
    }
}
