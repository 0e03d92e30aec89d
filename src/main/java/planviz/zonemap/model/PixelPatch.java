package planviz.zonemap.model;

import java.util.Arrays;

/**
 * Immutable rectangular ARGB patch cut from a {@link PixelBuffer}; used as a block snapshot.
 */
public final class PixelPatch {
    private final int width;
    private final int height;
    private final int[] argb;

    PixelPatch(int width, int height, int[] argb) {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("Invalid patch size.");
        if (argb == null || argb.length != width * height) {
            throw new IllegalArgumentException("Sample count does not match patch size.");
        }
        this.width = width;
        this.height = height;
        this.argb = argb;
    }

    /** Solid patch of one color, alpha forced to 255. */
    public static PixelPatch solid(int width, int height, int rgb) {
        int[] data = new int[width * height];
        Arrays.fill(data, rgb | 0xFF000000);
        return new PixelPatch(width, height, data);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public int getArgb(int x, int y) {
        return argb[y * width + x];
    }

    public boolean isOpaque() {
        for (int v : argb) {
            if ((v >>> 24) != 0xFF) return false;
        }
        return true;
    }
}
