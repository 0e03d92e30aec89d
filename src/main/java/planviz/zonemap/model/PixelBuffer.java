package planviz.zonemap.model;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Packed-ARGB pixel buffer backed by a {@code TYPE_INT_ARGB} image, so the same
 * samples can be read as a flat array and drawn into with Java2D.
 */
public class PixelBuffer {
    private final int width;
    private final int height;
    private final BufferedImage image;
    // row-major, one packed ARGB int per pixel
    private final int[] argb;

    // increments whenever the pixels are written
    private int version = 0;

    public PixelBuffer(int width, int height) {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("Invalid buffer size.");
        this.width = width;
        this.height = height;
        this.image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        this.argb = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
    }

    /** Decodes any {@link BufferedImage} into a fresh ARGB buffer (colors converted to sRGB). */
    public static PixelBuffer fromImage(BufferedImage img) {
        if (img == null) throw new IllegalArgumentException("img is null");
        PixelBuffer buf = new PixelBuffer(img.getWidth(), img.getHeight());
        img.getRGB(0, 0, buf.width, buf.height, buf.argb, 0, buf.width);
        return buf;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /** Monotonic version, bumped on every write. */
    public int getVersion() { return version; }

    private void bumpVersion() { version++; }

    public Rectangle bounds() { return new Rectangle(0, 0, width, height); }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public boolean contains(Rectangle r) {
        return r != null && r.x >= 0 && r.y >= 0 && r.width >= 0 && r.height >= 0
                && r.x + r.width <= width && r.y + r.height <= height;
    }

    /** Intersection of {@code r} with the buffer; may be empty. */
    public Rectangle clip(Rectangle r) {
        Rectangle c = bounds().intersection(r);
        if (c.width < 0 || c.height < 0) return new Rectangle(r.x, r.y, 0, 0);
        return c;
    }

    public int getArgb(int x, int y) {
        if (!inBounds(x, y)) return 0;
        return argb[y * width + x];
    }

    public int alpha(int x, int y) { return (getArgb(x, y) >>> 24) & 0xFF; }
    public int red(int x, int y)   { return (getArgb(x, y) >> 16) & 0xFF; }
    public int green(int x, int y) { return (getArgb(x, y) >> 8) & 0xFF; }
    public int blue(int x, int y)  { return getArgb(x, y) & 0xFF; }

    public void setArgb(int x, int y, int value) {
        if (!inBounds(x, y)) return;
        int idx = y * width + x;
        if (argb[idx] == value) return;
        argb[idx] = value;
        bumpVersion();
    }

    /**
     * Copies the pixels of {@code region} out of this buffer with every alpha forced to 255.
     * The region must lie inside the buffer.
     */
    public PixelPatch capture(Rectangle region) {
        if (!contains(region)) throw new IllegalArgumentException("Region outside buffer: " + region);
        int[] out = new int[region.width * region.height];
        for (int y = 0; y < region.height; y++) {
            int src = (region.y + y) * width + region.x;
            int dst = y * region.width;
            for (int x = 0; x < region.width; x++) {
                out[dst + x] = argb[src + x] | 0xFF000000;
            }
        }
        return new PixelPatch(region.width, region.height, out);
    }

    /** Replaces the pixels under the patch (no blending); parts outside the buffer are dropped. */
    public void put(PixelPatch patch, int px, int py) {
        if (patch == null) return;
        Rectangle dst = clip(new Rectangle(px, py, patch.getWidth(), patch.getHeight()));
        if (dst.isEmpty()) return;
        for (int y = dst.y; y < dst.y + dst.height; y++) {
            int row = y * width;
            for (int x = dst.x; x < dst.x + dst.width; x++) {
                argb[row + x] = patch.getArgb(x - px, y - py);
            }
        }
        bumpVersion();
    }

    /** Copies the samples of {@code region} from {@code src} (same size) into this buffer. */
    public void copyRegionFrom(PixelBuffer src, Rectangle region) {
        if (src == null) throw new IllegalArgumentException("src is null");
        if (src.width != width || src.height != height) {
            throw new IllegalArgumentException("Buffer sizes differ.");
        }
        Rectangle r = clip(region);
        if (r.isEmpty()) return;
        for (int y = r.y; y < r.y + r.height; y++) {
            int off = y * width + r.x;
            System.arraycopy(src.argb, off, argb, off, r.width);
        }
        bumpVersion();
    }

    /** Overwrites every sample with the contents of {@code src} (same size). */
    public void copyFrom(PixelBuffer src) {
        copyRegionFrom(src, bounds());
    }

    public void fill(int value) {
        Arrays.fill(argb, value);
        bumpVersion();
    }

    /**
     * Graphics onto the live pixels. Counts as a write; callers must dispose it.
     */
    public Graphics2D createGraphics() {
        bumpVersion();
        return image.createGraphics();
    }

    /** Live view of the pixels, for drawing onto other surfaces. Do not write through it. */
    public BufferedImage getImage() { return image; }

    /** Detached ARGB copy, safe to hand to encoders or other threads. */
    public BufferedImage toImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, width, height, argb, 0, width);
        return out;
    }

    public PixelBuffer copy() {
        PixelBuffer c = new PixelBuffer(width, height);
        System.arraycopy(argb, 0, c.argb, 0, argb.length);
        c.version = this.version;
        return c;
    }

    /** Bilinear-resampled copy at the given size. */
    public PixelBuffer scaledCopy(int newWidth, int newHeight) {
        if (newWidth == width && newHeight == height) return copy();
        PixelBuffer out = new PixelBuffer(newWidth, newHeight);
        Graphics2D g2 = out.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.drawImage(image, 0, 0, newWidth, newHeight, null);
        } finally {
            g2.dispose();
        }
        return out;
    }

    public boolean sameContent(PixelBuffer other) {
        return other != null && other.width == width && other.height == height
                && Arrays.equals(argb, other.argb);
    }
}
