package planviz.zonemap.overlay;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoTransformTest {

    private final GeoBounds box = new GeoBounds(10.0, 20.0, 40.0, 50.0);

    @Test
    @DisplayName("corners map to canvas corners with latitude flipped")
    void corners() {
        GeoTransform tx = GeoTransform.of(box, 1000, 500);

        Point2D.Double nw = tx.toCanvas(10.0, 50.0);
        Point2D.Double se = tx.toCanvas(20.0, 40.0);
        Point2D.Double mid = tx.toCanvas(15.0, 45.0);

        assertThat(nw.x).isEqualTo(0.0);
        assertThat(nw.y).isEqualTo(0.0);
        assertThat(se.x).isEqualTo(1000.0);
        assertThat(se.y).isEqualTo(500.0);
        assertThat(mid.x).isCloseTo(500.0, within(1e-9));
        assertThat(mid.y).isCloseTo(250.0, within(1e-9));
    }

    @Test
    @DisplayName("points outside the box are clamped onto the canvas")
    void clamped() {
        Point2D.Double p = GeoTransform.of(box, 100, 100).toCanvas(5.0, 60.0);
        assertThat(p.x).isEqualTo(0.0);
        assertThat(p.y).isEqualTo(0.0);
    }

    @Test
    @DisplayName("missing or degenerate bounds place nothing")
    void fallback() {
        GeoTransform none = GeoTransform.of(null, 100, 100);
        GeoTransform flat = GeoTransform.of(new GeoBounds(1, 1, 2, 3), 100, 100);

        assertThat(none.hasGeoBounds()).isFalse();
        assertThat(flat.hasGeoBounds()).isFalse();
        assertThat(none.toCanvas(1, 2)).isNull();
    }

    @Test
    @DisplayName("non-finite input is rejected")
    void nonFinite() {
        GeoTransform tx = GeoTransform.of(box, 100, 100);
        assertThat(tx.toCanvas(Double.NaN, 45)).isNull();
        assertThat(tx.toCanvas(15, Double.POSITIVE_INFINITY)).isNull();
    }
}
