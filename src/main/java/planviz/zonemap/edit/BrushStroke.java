package planviz.zonemap.edit;

import java.awt.Color;
import java.awt.Point;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Points of one draw/erase gesture, in image coordinates. */
public final class BrushStroke {

    private final Color color;
    private final int width;
    private final boolean erase;
    private final List<Point> points = new ArrayList<>();

    BrushStroke(Color color, int width, boolean erase, Point start) {
        this.color = color;
        this.width = width;
        this.erase = erase;
        points.add(new Point(start));
    }

    public Color getColor() { return color; }
    public int getWidth() { return width; }
    public boolean isErase() { return erase; }

    public List<Point> getPoints() { return Collections.unmodifiableList(points); }

    Point last() { return points.get(points.size() - 1); }

    void add(Point p) { points.add(new Point(p)); }

    /** Area touched by the stroke, including the brush radius. */
    public Rectangle dirtyBounds() {
        Rectangle r = null;
        for (Point p : points) {
            if (r == null) r = new Rectangle(p.x, p.y, 1, 1);
            else r.add(p);
        }
        int pad = width / 2 + 2;
        r.grow(pad, pad);
        return r;
    }
}
