package planviz.zonemap.edit;

import planviz.zonemap.model.PixelPatch;

import java.awt.Point;
import java.awt.Rectangle;

/** The block currently held by the pointer. */
final class DragRecord {

    private final String blockId;
    private final Point grabOffset;
    private final Rectangle originalBounds;
    private final PixelPatch snapshot;

    // last position painted on the canvas
    private Rectangle current;

    DragRecord(String blockId, Point grabOffset, Rectangle originalBounds, PixelPatch snapshot) {
        this.blockId = blockId;
        this.grabOffset = new Point(grabOffset);
        this.originalBounds = new Rectangle(originalBounds);
        this.snapshot = snapshot;
        this.current = new Rectangle(originalBounds);
    }

    String getBlockId() { return blockId; }
    Point getGrabOffset() { return new Point(grabOffset); }
    Rectangle getOriginalBounds() { return new Rectangle(originalBounds); }
    PixelPatch getSnapshot() { return snapshot; }
    Rectangle getCurrent() { return new Rectangle(current); }

    void setCurrent(Rectangle r) { this.current = new Rectangle(r); }

    boolean hasLeftOrigin() {
        return current.x != originalBounds.x || current.y != originalBounds.y;
    }
}
