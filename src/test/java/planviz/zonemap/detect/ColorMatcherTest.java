package planviz.zonemap.detect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ColorMatcherTest {

    @Test
    @DisplayName("distance is zero exactly for equal colors")
    void zeroForEqual() {
        assertThat(ColorMatcher.distance(59, 130, 246, 59, 130, 246)).isZero();
        assertThat(ColorMatcher.distance(59, 130, 246, 59, 130, 247)).isPositive();
    }

    @Test
    @DisplayName("distance is symmetric and non-negative")
    void symmetric() {
        int[][] samples = {{0, 0, 0}, {255, 255, 255}, {255, 107, 107}, {45, 212, 191}, {12, 200, 33}};
        for (int[] a : samples) {
            for (int[] b : samples) {
                double ab = ColorMatcher.distance(a[0], a[1], a[2], b[0], b[1], b[2]);
                double ba = ColorMatcher.distance(b[0], b[1], b[2], a[0], a[1], a[2]);
                assertThat(ab).isGreaterThanOrEqualTo(0).isCloseTo(ba, within(1e-9));
            }
        }
    }

    @Test
    @DisplayName("green differences weigh four times")
    void greenWeight() {
        assertThat(ColorMatcher.distance(100, 100, 100, 100, 110, 100)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("pixel classes use strict thresholds")
    void classes() {
        assertThat(ColorMatcher.isNearWhite(246, 246, 246)).isTrue();
        assertThat(ColorMatcher.isNearWhite(245, 255, 255)).isFalse();
        assertThat(ColorMatcher.isNearBlack(24, 24, 24)).isTrue();
        assertThat(ColorMatcher.isNearBlack(25, 0, 0)).isFalse();
        assertThat(ColorMatcher.isBorder(60, 60, 60, 255)).isTrue();
        assertThat(ColorMatcher.isBorder(60, 60, 60, 200)).isFalse();
    }
}
