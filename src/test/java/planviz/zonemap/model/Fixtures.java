package planviz.zonemap.model;

import java.awt.Color;
import java.awt.Rectangle;

/** Small synthetic rasters for tests. */
public final class Fixtures {

    public static final int WHITE = 0xFFFFFFFF;
    public static final Color BLUE = new Color(59, 130, 246);
    public static final Color COMMERCIAL_RED = new Color(255, 107, 107);
    public static final Color PARK_TEAL = new Color(45, 212, 191);

    private Fixtures() {}

    public static PixelBuffer white(int w, int h) {
        PixelBuffer b = new PixelBuffer(w, h);
        b.fill(WHITE);
        return b;
    }

    public static void fillRect(PixelBuffer b, Rectangle r, Color c) {
        int argb = c.getRGB() | 0xFF000000;
        for (int y = r.y; y < r.y + r.height; y++) {
            for (int x = r.x; x < r.x + r.width; x++) {
                b.setArgb(x, y, argb);
            }
        }
    }

    /** Opaque pixels that differ everywhere, so copies and restores are easy to check. */
    public static PixelBuffer gradient(int w, int h) {
        PixelBuffer b = new PixelBuffer(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                b.setArgb(x, y, 0xFF000000 | ((x * 7) & 0xFF) << 16 | ((y * 5) & 0xFF) << 8 | ((x + y) & 0xFF));
            }
        }
        return b;
    }
}
