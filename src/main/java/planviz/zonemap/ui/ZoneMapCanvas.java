package planviz.zonemap.ui;

import planviz.zonemap.edit.EditSession;
import planviz.zonemap.edit.EditTool;
import planviz.zonemap.render.RenderPipeline;

import javax.swing.*;
import java.awt.*;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;

/**
 * Shows the session's canvas at the current zoom and turns mouse input into
 * image-coordinate pointer events.
 */
public class ZoneMapCanvas extends JPanel {

    private final EditSession session;
    private final RenderPipeline pipeline;

    private double zoom = 1.0;
    private double zoomMin = 0.5;
    private double zoomMax = 3.0;

    private Point lastMouseScreen;

    public ZoneMapCanvas(EditSession session, RenderPipeline pipeline) {
        this.session = session;
        this.pipeline = pipeline;
        setBackground(new Color(0xf3f4f6));
        setFocusable(true);

        MouseAdapter ma = new MouseAdapter() {
            @Override public void mousePressed(MouseEvent e) {
                requestFocusInWindow();
                if (!SwingUtilities.isLeftMouseButton(e)) return;
                session.pointerDown(toImage(e.getPoint()));
            }

            @Override public void mouseDragged(MouseEvent e) {
                lastMouseScreen = e.getPoint();
                if (!SwingUtilities.isLeftMouseButton(e)) return;
                session.pointerMove(toImage(e.getPoint()));
            }

            @Override public void mouseMoved(MouseEvent e) {
                lastMouseScreen = e.getPoint();
                session.pointerMove(toImage(e.getPoint()));
                if (session.getTool().isBrush()) repaint();
            }

            @Override public void mouseReleased(MouseEvent e) {
                if (!SwingUtilities.isLeftMouseButton(e)) return;
                session.pointerUp(toImage(e.getPoint()));
            }

            @Override public void mouseExited(MouseEvent e) {
                lastMouseScreen = null;
                repaint();
            }
        };
        addMouseListener(ma);
        addMouseMotionListener(ma);
    }

    // ==========================================================
    // Zoom
    // ==========================================================

    public void setZoomBounds(double min, double max) {
        this.zoomMin = min;
        this.zoomMax = Math.max(min, max);
        setZoom(zoom);
    }

    public void setZoom(double z) {
        // round to one decimal so repeated steps do not drift
        double r = Math.round(z * 10.0) / 10.0;
        this.zoom = Math.max(zoomMin, Math.min(zoomMax, r));
        revalidate();
        repaint();
    }

    public double getZoom() { return zoom; }

    // ==========================================================
    // Coordinates
    // ==========================================================

    Point toImage(Point screen) {
        int ix = (int) Math.floor(screen.x / zoom);
        int iy = (int) Math.floor(screen.y / zoom);
        return new Point(ix, iy);
    }

    @Override
    public Dimension getPreferredSize() {
        if (!session.hasImage()) return new Dimension(800, 600);
        return new Dimension(
                (int) Math.ceil(session.getCanvas().getWidth() * zoom),
                (int) Math.ceil(session.getCanvas().getHeight() * zoom));
    }

    // ==========================================================
    // Painting
    // ==========================================================

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);

        if (!session.hasImage()) {
            drawCenteredText(g, "Open an image (PNG, JPEG or PDF) to start editing.");
            return;
        }

        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g2.scale(zoom, zoom);
            pipeline.renderDisplay(g2, session);
        } finally {
            g2.dispose();
        }

        if (session.getTool().isBrush() && lastMouseScreen != null) {
            Graphics2D g3 = (Graphics2D) g.create();
            try {
                g3.setColor(session.getTool() == EditTool.ERASE ? new Color(0, 0, 0, 160) : new Color(255, 255, 255, 200));
                int d = (int) Math.round(session.getBrushSize() * zoom);
                g3.drawOval(lastMouseScreen.x - d / 2, lastMouseScreen.y - d / 2, d, d);
            } finally {
                g3.dispose();
            }
        }
    }

    private void drawCenteredText(Graphics g, String msg) {
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setColor(Color.GRAY);
            FontMetrics fm = g2.getFontMetrics();
            int x = (getWidth() - fm.stringWidth(msg)) / 2;
            int y = getHeight() / 2;
            g2.drawString(msg, Math.max(10, x), Math.max(20, y));
        } finally {
            g2.dispose();
        }
    }
}
