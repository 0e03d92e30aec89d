package planviz.zonemap.render;

import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.PixelPatch;

import java.awt.*;
import java.awt.geom.Line2D;

/**
 * Pixel operations the edit session performs on the working canvas. Every operation opens its
 * own {@link Graphics2D} (when it needs one) and disposes it before returning.
 */
public final class CanvasCompositor {

    public static final Color VACATED_FILL = Color.WHITE;
    public static final Color VACATED_MARKER = new Color(0xCC, 0xCC, 0xCC);

    private static final BasicStroke VACATED_STROKE = new BasicStroke(
            2f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, new float[]{4f, 4f}, 0f);

    private CanvasCompositor() {}

    /**
     * Blanks a rectangle a block was lifted from and draws the dashed "vacated" marker.
     * The marker stays strictly inside {@code r}.
     */
    public static void fillVacated(PixelBuffer canvas, Rectangle r) {
        Rectangle c = canvas.clip(r);
        if (c.isEmpty()) return;

        Graphics2D g2 = canvas.createGraphics();
        try {
            g2.setComposite(AlphaComposite.Src);
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            g2.setClip(c);
            g2.setColor(VACATED_FILL);
            g2.fillRect(c.x, c.y, c.width, c.height);

            if (c.width > 4 && c.height > 4) {
                g2.setColor(VACATED_MARKER);
                g2.setStroke(VACATED_STROKE);
                g2.drawRect(c.x + 2, c.y + 2, c.width - 4, c.height - 4);
            }
        } finally {
            g2.dispose();
        }
    }

    /** Copies the untouched base image back under {@code r}. */
    public static void restoreFromBase(PixelBuffer canvas, PixelBuffer base, Rectangle r) {
        if (base == null || r == null) return;
        canvas.copyRegionFrom(base, r);
    }

    /** Replaces the pixels at (x, y) with the patch; no blending. */
    public static void paste(PixelBuffer canvas, PixelPatch patch, int x, int y) {
        canvas.put(patch, x, y);
    }

    /** Solid opaque rectangle, for stamped blocks. */
    public static void fillSolid(PixelBuffer canvas, Rectangle r, Color color) {
        Rectangle c = canvas.clip(r);
        if (c.isEmpty()) return;
        Graphics2D g2 = canvas.createGraphics();
        try {
            g2.setComposite(AlphaComposite.Src);
            g2.setColor(new Color(color.getRGB() | 0xFF000000, true));
            g2.fillRect(c.x, c.y, c.width, c.height);
        } finally {
            g2.dispose();
        }
    }

    /**
     * One brush segment with round caps and joins. Erasing clears to transparent
     * (destination-out) instead of painting.
     */
    public static void strokeSegment(PixelBuffer canvas, Point from, Point to, Color color, float width, boolean erase) {
        if (from == null || to == null) return;
        Graphics2D g2 = canvas.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setStroke(new BasicStroke(Math.max(1f, width), BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
            if (erase) {
                g2.setComposite(AlphaComposite.DstOut);
                g2.setColor(Color.BLACK);
            } else {
                g2.setComposite(AlphaComposite.SrcOver);
                g2.setColor(color == null ? Color.BLACK : color);
            }
            g2.draw(new Line2D.Double(from.x, from.y, to.x, to.y));
        } finally {
            g2.dispose();
        }
    }
}
