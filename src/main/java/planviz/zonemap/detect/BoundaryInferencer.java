package planviz.zonemap.detect;

import planviz.zonemap.model.PixelBuffer;

import java.awt.Color;
import java.awt.Rectangle;

/**
 * Grows an axis-aligned rectangle around a seed by walking outwards in each direction
 * while sampled strips still look like the block (its color within a widened tolerance,
 * or a dark border). Left/right first, then up/down across the found width.
 */
public class BoundaryInferencer {

    private enum Sample { SKIP, INSIDE, OUTSIDE, WHITE }

    private final DetectionParams params;

    public BoundaryInferencer(DetectionParams params) {
        this.params = (params == null) ? new DetectionParams() : params;
    }

    /** @return the block rectangle in buffer coordinates, or null when the seed is not a block pixel */
    public Rectangle infer(PixelBuffer buf, ScanSeed seed) {
        return infer(buf, seed.getX(), seed.getY(), seed.getMatchedColor(), seed.getEntry().getTolerance());
    }

    public Rectangle infer(PixelBuffer buf, int sx, int sy, Color target, double tolerance) {
        if (!buf.inBounds(sx, sy)) return null;

        int w = buf.getWidth();
        int h = buf.getHeight();

        int seedArgb = buf.getArgb(sx, sy);
        if (((seedArgb >>> 24) & 0xFF) < params.boundaryMinAlpha) return null;
        if (ColorMatcher.distance(seedArgb, target) >= tolerance * params.seedToleranceFactor) return null;

        double limit = tolerance * params.boundaryToleranceFactor;

        int rowFrom = Math.max(0, sy - params.sampleHalfSpan);
        int rowTo = Math.min(h, sy + params.sampleHalfSpan);

        int left = sx;
        for (int x = sx - 1; x >= 0; x--) {
            if (!columnStripInside(buf, x, rowFrom, rowTo, target, limit)) break;
            left = x;
        }

        int right = sx;
        for (int x = sx + 1; x < w; x++) {
            if (!columnStripInside(buf, x, rowFrom, rowTo, target, limit)) break;
            right = x;
        }

        int top = sy;
        for (int y = sy - 1; y >= 0; y--) {
            if (!rowStripInside(buf, y, left, right, target, limit)) break;
            top = y;
        }

        int bottom = sy;
        for (int y = sy + 1; y < h; y++) {
            if (!rowStripInside(buf, y, left, right, target, limit)) break;
            bottom = y;
        }

        Rectangle r = new Rectangle(left, top, right - left + 1, bottom - top + 1);
        return r.intersection(buf.bounds());
    }

    // =========================
    // Strips
    // =========================

    private boolean columnStripInside(PixelBuffer buf, int x, int fromY, int toY, Color target, double limit) {
        for (int y = fromY; y < toY; y += params.sampleStepVertical) {
            Sample s = classify(buf.getArgb(x, y), target, limit);
            if (s == Sample.INSIDE) return true;
            if (s == Sample.WHITE) return false;
        }
        return false;
    }

    private boolean rowStripInside(PixelBuffer buf, int y, int left, int right, Color target, double limit) {
        int end = Math.min(right, buf.getWidth() - 1);
        for (int x = left; x <= end; x += params.sampleStepHorizontal) {
            Sample s = classify(buf.getArgb(x, y), target, limit);
            if (s == Sample.INSIDE) return true;
            if (s == Sample.WHITE) return false;
        }
        return false;
    }

    private Sample classify(int argb, Color target, double limit) {
        int a = (argb >>> 24) & 0xFF;
        if (a < params.boundaryMinAlpha) return Sample.SKIP;

        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        if (ColorMatcher.isNearWhite(r, g, b)) return Sample.WHITE;

        if (ColorMatcher.isBorder(r, g, b, a)) return Sample.INSIDE;
        return ColorMatcher.distance(argb, target) < limit ? Sample.INSIDE : Sample.OUTSIDE;
    }
}
