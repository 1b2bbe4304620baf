package org.gridiron.lineup;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyTest {

    @Test
    void parsesKnownNamesIgnoringCaseAndWhitespace() {
        assertThat(Strategy.parse("balanced")).isEqualTo(Strategy.BALANCED);
        assertThat(Strategy.parse(" Floor ")).isEqualTo(Strategy.FLOOR);
        assertThat(Strategy.parse("CEILING")).isEqualTo(Strategy.CEILING);
    }

    @Test
    void rejectsUnknownValuesInsteadOfDefaulting() {
        assertThatThrownBy(() -> Strategy.parse("aggressive"))
                .isInstanceOf(InvalidStrategyException.class)
                .hasMessageContaining("aggressive")
                .hasMessageContaining("balanced, floor, ceiling");
    }

    @Test
    void rejectsNullAndBlank() {
        assertThatThrownBy(() -> Strategy.parse(null)).isInstanceOf(InvalidStrategyException.class);
        assertThatThrownBy(() -> Strategy.parse("  ")).isInstanceOf(InvalidStrategyException.class);
    }

    @Test
    void rejectedValueIsKept() {
        InvalidStrategyException e = new InvalidStrategyException("yolo", Strategy.allowedValues());
        assertThat(e.getRejectedValue()).isEqualTo("yolo");
    }

    @Test
    void keyIsLowerCaseName() {
        assertThat(Strategy.FLOOR.key()).isEqualTo("floor");
    }
}
