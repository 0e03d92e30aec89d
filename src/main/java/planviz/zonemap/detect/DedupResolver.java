package planviz.zonemap.detect;

import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether a freshly inferred rectangle is a new block, a better view of one already
 * found, or noise. Works in analysis coordinates; accepted candidates carry both the analysis
 * rectangle and the rectangle rescaled to the original image.
 */
public class DedupResolver {

    public enum Outcome {
        /** Too small for its zone kind. */
        TOO_SMALL,
        /** Overlaps or coincides with an accepted block. */
        DUPLICATE,
        ACCEPTED,
        /** Accepted and replaced one or more smaller views of the same block. */
        REPLACED
    }

    private final DetectionParams params;
    private final int minBlockSize;
    private final double scale;
    private final int originalWidth;
    private final int originalHeight;

    private final List<Candidate> accepted = new ArrayList<>();

    /**
     * @param scale          analysis size / original size (1.0 when not downsampled)
     * @param originalWidth  used to clamp rescaled rectangles
     */
    public DedupResolver(DetectionParams params, int minBlockSize, double scale, int originalWidth, int originalHeight) {
        if (scale <= 0) throw new IllegalArgumentException("scale must be > 0");
        this.params = (params == null) ? new DetectionParams() : params;
        this.minBlockSize = minBlockSize;
        this.scale = scale;
        this.originalWidth = originalWidth;
        this.originalHeight = originalHeight;
    }

    public List<Candidate> getAccepted() {
        return Collections.unmodifiableList(accepted);
    }

    public void clear() {
        accepted.clear();
    }

    public int effectiveMinSize(ZoneType type) {
        if (type.isOverlay()) {
            return Math.max(params.overlayMinSizeFloor, (int) Math.floor(minBlockSize * params.overlayMinSizeFactor));
        }
        return minBlockSize;
    }

    public Outcome offer(Rectangle work, ZoneType type, Color color) {
        if (work == null || work.isEmpty()) return Outcome.TOO_SMALL;

        int min = effectiveMinSize(type);
        double minArea = (double) min * min * (type.isOverlay() ? params.overlayMinAreaFactor : params.areaMinAreaFactor);
        if (work.width < min || work.height < min || area(work) < minArea) return Outcome.TOO_SMALL;

        List<Candidate> replaced = new ArrayList<>();
        for (Candidate c : accepted) {
            Rectangle e = c.getWorkBounds();

            if (c.getType() != type) {
                if (overlapExceeds(work, e, params.crossTypeOverlap)) return Outcome.DUPLICATE;
                continue;
            }

            double dx = centerX(work) - centerX(e);
            double dy = centerY(work) - centerY(e);
            double centerDistance = Math.sqrt(dx * dx + dy * dy);
            double avgSide = (work.width + work.height + e.width + e.height) / 4.0;

            if (centerDistance < avgSide * params.sameCenterFactor) {
                if (area(work) > area(e) * params.replaceAreaFactor) {
                    replaced.add(c);
                    continue;
                }
                return Outcome.DUPLICATE;
            }

            if (overlapExceeds(work, e, params.sameTypeOverlap)) return Outcome.DUPLICATE;
        }

        accepted.removeAll(replaced);
        accepted.add(new Candidate(work, rescale(work), type, color));
        return replaced.isEmpty() ? Outcome.ACCEPTED : Outcome.REPLACED;
    }

    /** Analysis rectangle back to original-image coordinates. */
    public Rectangle rescale(Rectangle work) {
        if (scale == 1.0) return new Rectangle(work);
        int x = (int) Math.floor(work.x / scale);
        int y = (int) Math.floor(work.y / scale);
        int w = (int) Math.floor(work.width / scale);
        int h = (int) Math.floor(work.height / scale);
        Rectangle r = new Rectangle(x, y, Math.max(1, w), Math.max(1, h));
        return r.intersection(new Rectangle(0, 0, originalWidth, originalHeight));
    }

    // =========================
    // Geometry
    // =========================

    static long area(Rectangle r) {
        return (long) r.width * r.height;
    }

    static long overlapArea(Rectangle a, Rectangle b) {
        long ox = Math.max(0, Math.min(a.x + a.width, b.x + b.width) - Math.max(a.x, b.x));
        long oy = Math.max(0, Math.min(a.y + a.height, b.y + b.height) - Math.max(a.y, b.y));
        return ox * oy;
    }

    private static boolean overlapExceeds(Rectangle a, Rectangle b, double fraction) {
        long o = overlapArea(a, b);
        return o > area(a) * fraction || o > area(b) * fraction;
    }

    private static double centerX(Rectangle r) { return r.x + r.width / 2.0; }
    private static double centerY(Rectangle r) { return r.y + r.height / 2.0; }
}
