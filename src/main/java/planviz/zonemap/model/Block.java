package planviz.zonemap.model;

import java.awt.Color;
import java.awt.Point;
import java.awt.Rectangle;

/**
 * A detected or stamped rectangular zone region. Mutated only through {@link BlockRegistry}.
 */
public class Block {

    private final String id;
    private final ZoneType type;
    private final Color color;

    private Rectangle bounds;

    // opaque copy of the block's pixels, taken after detection and on every pick-up
    private PixelPatch snapshot;

    private boolean moved = false;
    // where the block sat before its first move
    private Rectangle originalBounds;

    Block(String id, ZoneType type, Color color, Rectangle bounds) {
        this.id = id;
        this.type = type;
        this.color = color;
        this.bounds = new Rectangle(bounds);
    }

    public Block copy() {
        Block b = new Block(id, type, color, bounds);
        b.snapshot = snapshot;
        b.moved = moved;
        b.originalBounds = (originalBounds == null) ? null : new Rectangle(originalBounds);
        return b;
    }

    public String getId() { return id; }
    public ZoneType getType() { return type; }

    /** Reference palette color the block matched (or the stamp color). */
    public Color getColor() { return color; }

    public Rectangle getBounds() { return new Rectangle(bounds); }
    void setBounds(Rectangle r) { this.bounds = new Rectangle(r); }

    public PixelPatch getSnapshot() { return snapshot; }
    void setSnapshot(PixelPatch p) { this.snapshot = p; }

    public boolean isMoved() { return moved; }

    public Rectangle getOriginalBounds() {
        return (originalBounds == null) ? null : new Rectangle(originalBounds);
    }

    void markMoved(Rectangle original) {
        if (!moved) {
            moved = true;
            originalBounds = new Rectangle(original);
        }
    }

    public int area() { return bounds.width * bounds.height; }

    /** Edges are inclusive, so a pointer on the right/bottom border still hits. */
    public boolean containsPoint(Point p) {
        if (p == null) return false;
        return p.x >= bounds.x && p.x <= bounds.x + bounds.width
                && p.y >= bounds.y && p.y <= bounds.y + bounds.height;
    }

    @Override
    public String toString() {
        return (type == null ? "Block" : type.getLabel()) + " (" + id + ") "
                + bounds.x + "," + bounds.y + " " + bounds.width + "x" + bounds.height;
    }
}
