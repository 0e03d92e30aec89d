package planviz.zonemap.detect;

import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.awt.Rectangle;

/** A detected block before it reaches the registry. */
public final class Candidate {

    private final Rectangle workBounds;
    private final Rectangle bounds;
    private final ZoneType type;
    private final Color color;

    public Candidate(Rectangle workBounds, Rectangle bounds, ZoneType type, Color color) {
        this.workBounds = new Rectangle(workBounds);
        this.bounds = new Rectangle(bounds);
        this.type = type;
        this.color = color;
    }

    /** Analysis (possibly downsampled) coordinates. */
    public Rectangle getWorkBounds() { return new Rectangle(workBounds); }

    /** Original image coordinates. */
    public Rectangle getBounds() { return new Rectangle(bounds); }

    public ZoneType getType() { return type; }
    public Color getColor() { return color; }

    @Override
    public String toString() {
        return type.getLabel() + " " + bounds.x + "," + bounds.y + " " + bounds.width + "x" + bounds.height;
    }
}
