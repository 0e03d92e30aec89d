package planviz.zonemap.render;

import planviz.zonemap.edit.EditSession;
import planviz.zonemap.edit.EditTool;
import planviz.zonemap.model.Block;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.overlay.GeoBounds;
import planviz.zonemap.overlay.GeoTransform;
import planviz.zonemap.overlay.RoadClass;
import planviz.zonemap.overlay.RoadFeature;
import planviz.zonemap.overlay.RoadNetwork;

import java.awt.*;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Draws the editor picture in image coordinates: canvas, then roads, then (display only)
 * the move-tool decorations. The caller sets up zoom on the {@link Graphics2D}.
 */
public class RenderPipeline {

    private static final Color OUTLINE = new Color(0x3b82f6);
    private static final Color OUTLINE_HOVER = new Color(0x10b981);
    private static final Color OUTLINE_DRAG = new Color(0xef4444);

    private static final float[] OUTLINE_DASH = {8f, 4f};

    private RoadNetwork roads = RoadNetwork.empty();
    private GeoBounds polygonBounds;
    private boolean showRoads = true;
    private final Set<RoadClass> visible = EnumSet.allOf(RoadClass.class);

    // ==========================================================
    // Road overlay state
    // ==========================================================

    public void setRoadNetwork(RoadNetwork rn) {
        this.roads = (rn == null) ? RoadNetwork.empty() : rn;
    }

    public RoadNetwork getRoadNetwork() { return roads; }

    public void setPolygonBounds(GeoBounds b) { this.polygonBounds = b; }

    public void setShowRoads(boolean on) { this.showRoads = on; }
    public boolean isShowRoads() { return showRoads; }

    public void setRoadVisible(RoadClass c, boolean on) {
        if (c == null) return;
        if (on) visible.add(c);
        else visible.remove(c);
    }

    public boolean isRoadVisible(RoadClass c) { return visible.contains(c); }

    public Set<RoadClass> getVisibleRoads() { return Collections.unmodifiableSet(visible); }

    /** Transform for a canvas of this size, following polygon → roads → fallback. */
    public GeoTransform transformFor(int width, int height) {
        return GeoTransform.of(roads.resolveBounds(polygonBounds), width, height);
    }

    // ==========================================================
    // Entry points
    // ==========================================================

    /** Everything the operator sees. */
    public void renderDisplay(Graphics2D g, EditSession session) {
        if (session == null || !session.hasImage()) return;
        PixelBuffer canvas = session.getCanvas();

        g.drawImage(canvas.getImage(), 0, 0, null);
        drawRoads(g, canvas.getWidth(), canvas.getHeight());

        if (session.getTool() == EditTool.MOVE) {
            drawBlockDecorations(g, session);
        }
        Rectangle drag = session.getDragBounds();
        if (drag != null) {
            drawDragOutline(g, drag);
        }
    }

    /** Canvas plus roads; no editor decorations. */
    public BufferedImage renderExport(PixelBuffer canvas) {
        BufferedImage out = new BufferedImage(canvas.getWidth(), canvas.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2 = out.createGraphics();
        try {
            g2.drawImage(canvas.getImage(), 0, 0, null);
            drawRoads(g2, canvas.getWidth(), canvas.getHeight());
        } finally {
            g2.dispose();
        }
        return out;
    }

    // ==========================================================
    // Roads
    // ==========================================================

    /** @return number of features drawn */
    public int drawRoads(Graphics2D g, int width, int height) {
        if (!showRoads || roads.isEmpty()) return 0;
        GeoTransform tx = transformFor(width, height);
        if (!tx.hasGeoBounds()) return 0;

        List<RoadFeature> features = roads.visibleFeatures(visible);
        int drawn = 0;

        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            for (RoadFeature f : features) {
                Path2D.Double path = toPath(f, tx);
                if (path == null) continue;

                RoadStyle st = RoadStyle.forClass(f.getStyleClass());
                g2.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, st.getOpacity()));
                g2.setColor(st.getColor());
                g2.setStroke(st.toStroke());
                g2.draw(path);
                drawn++;
            }
        } finally {
            g2.dispose();
        }
        return drawn;
    }

    static Path2D.Double toPath(RoadFeature f, GeoTransform tx) {
        Path2D.Double path = new Path2D.Double();
        boolean any = false;
        for (List<double[]> part : f.getParts()) {
            boolean first = true;
            for (double[] c : part) {
                Point2D.Double p = tx.toCanvas(c[0], c[1]);
                if (p == null) continue;
                if (first) {
                    path.moveTo(p.x, p.y);
                    first = false;
                } else {
                    path.lineTo(p.x, p.y);
                }
                any = true;
            }
        }
        return any ? path : null;
    }

    // ==========================================================
    // Move-tool decorations
    // ==========================================================

    private void drawBlockDecorations(Graphics2D g, EditSession session) {
        String hovered = session.getHoveredBlockId();
        String dragged = session.getDraggedBlockId();

        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setFont(new Font("SansSerif", Font.BOLD, 12));
            for (Block b : session.getBlocks()) {
                if (b.getId().equals(dragged)) continue;
                boolean hot = b.getId().equals(hovered);
                Rectangle r = b.getBounds();

                g2.setColor(hot ? OUTLINE_HOVER : OUTLINE);
                g2.setStroke(new BasicStroke(hot ? 5f : 3f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
                        10f, OUTLINE_DASH, 0f));
                g2.drawRect(r.x, r.y, r.width, r.height);

                if (hot) {
                    g2.setColor(new Color(16, 185, 129, 26));
                    g2.fillRect(r.x, r.y, r.width, r.height);
                }

                int labelW = Math.min(120, r.width - 4);
                if (labelW > 0) {
                    g2.setColor(hot ? new Color(16, 185, 129, 230) : new Color(59, 130, 246, 204));
                    g2.fillRect(r.x + 2, r.y + 2, labelW, 22);
                    g2.setColor(Color.WHITE);
                    Shape oldClip = g2.getClip();
                    g2.clipRect(r.x + 2, r.y + 2, labelW, 22);
                    g2.drawString(b.getType().getLabel(), r.x + 5, r.y + 17);
                    g2.setClip(oldClip);
                }
            }
        } finally {
            g2.dispose();
        }
    }

    private void drawDragOutline(Graphics2D g, Rectangle r) {
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setColor(OUTLINE_DRAG);
            g2.setStroke(new BasicStroke(3f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, OUTLINE_DASH, 0f));
            g2.drawRect(r.x, r.y, r.width, r.height);
            g2.setColor(new Color(239, 68, 68, 26));
            g2.fillRect(r.x, r.y, r.width, r.height);
        } finally {
            g2.dispose();
        }
    }
}
