package planviz.zonemap.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelBufferTest {

    @Test
    @DisplayName("capture forces every alpha to 255")
    void captureIsOpaque() {
        PixelBuffer b = new PixelBuffer(10, 10);
        b.setArgb(3, 3, 0x10ABCDEF);

        PixelPatch p = b.capture(new Rectangle(2, 2, 4, 4));

        assertThat(p.isOpaque()).isTrue();
        assertThat(p.getArgb(1, 1)).isEqualTo(0xFFABCDEF);
    }

    @Test
    @DisplayName("capture outside the buffer is rejected")
    void captureOutside() {
        PixelBuffer b = new PixelBuffer(10, 10);
        assertThatThrownBy(() -> b.capture(new Rectangle(8, 8, 4, 4)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("put clips patches that hang over the edge")
    void putClips() {
        PixelBuffer b = Fixtures.white(10, 10);
        b.put(PixelPatch.solid(4, 4, 0x112233), 8, 8);

        assertThat(b.getArgb(9, 9)).isEqualTo(0xFF112233);
        assertThat(b.getArgb(7, 7)).isEqualTo(Fixtures.WHITE);
    }

    @Test
    @DisplayName("copyRegionFrom restores only the region")
    void copyRegion() {
        PixelBuffer base = Fixtures.gradient(20, 20);
        PixelBuffer work = Fixtures.white(20, 20);

        work.copyRegionFrom(base, new Rectangle(5, 5, 5, 5));

        assertThat(work.getArgb(5, 5)).isEqualTo(base.getArgb(5, 5));
        assertThat(work.getArgb(9, 9)).isEqualTo(base.getArgb(9, 9));
        assertThat(work.getArgb(4, 4)).isEqualTo(Fixtures.WHITE);
    }

    @Test
    @DisplayName("writes bump the version; copies are detached")
    void versionAndCopy() {
        PixelBuffer b = Fixtures.white(4, 4);
        int v = b.getVersion();
        PixelBuffer c = b.copy();

        b.setArgb(0, 0, 0xFF000000);

        assertThat(b.getVersion()).isGreaterThan(v);
        assertThat(c.getArgb(0, 0)).isEqualTo(Fixtures.WHITE);
        assertThat(b.sameContent(c)).isFalse();
    }
}
