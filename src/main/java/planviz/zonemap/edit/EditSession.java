package planviz.zonemap.edit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.detect.Candidate;
import planviz.zonemap.detect.DetectionParams;
import planviz.zonemap.model.Block;
import planviz.zonemap.model.BlockRegistry;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.PixelPatch;
import planviz.zonemap.model.ZoneType;
import planviz.zonemap.render.CanvasCompositor;

import java.awt.Color;
import java.awt.Point;
import java.awt.Rectangle;
import java.util.Collection;
import java.util.List;

/**
 * Editing state for one image: the untouched base, the working canvas, the block registry,
 * the active tool and gesture, and the undo history.
 * <p>
 * Pointer events are in image coordinates. All calls belong on one thread (the EDT).
 */
public class EditSession {

    private static final Logger logger = LoggerFactory.getLogger(EditSession.class);

    public static final Color DEFAULT_COLOR = new Color(0x3b82f6);
    public static final int DEFAULT_BRUSH_SIZE = 10;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final DetectionParams params;
    private final CanvasHistory history;

    private PixelBuffer base;
    private PixelBuffer canvas;
    private BlockRegistry registry;

    private EditTool tool = EditTool.DRAW;
    private EditState state = EditState.IDLE;
    private Color color = DEFAULT_COLOR;
    private int brushSize = DEFAULT_BRUSH_SIZE;

    private DragRecord drag;
    private BrushStroke stroke;
    private String hoveredId;
    private boolean inputLocked;

    private Runnable onChanged;

    public EditSession() {
        this(new DetectionParams(), DEFAULT_HISTORY_LIMIT);
    }

    public EditSession(DetectionParams params, int historyLimit) {
        this.params = (params == null) ? new DetectionParams() : params;
        this.history = new CanvasHistory(historyLimit);
    }

    // ==========================================================
    // Image + blocks
    // ==========================================================

    /** Starts over on a new image: empty registry, history holding only the loaded image. */
    public void loadImage(PixelBuffer image) {
        if (image == null) throw new IllegalArgumentException("image is null");
        resetGesture();
        this.base = image.copy();
        this.canvas = image.copy();
        this.registry = new BlockRegistry(image.getWidth(), image.getHeight());
        history.clear();
        history.record("load", canvas, registry.all());
        fireChanged();
    }

    /** Drops the current image (e.g. after a failed load). */
    public void unloadImage() {
        resetGesture();
        base = null;
        canvas = null;
        registry = null;
        history.clear();
        fireChanged();
    }

    /**
     * Replaces the registry with detection results run over the working canvas; snapshots
     * are captured from it. The first detection after a load folds into the load entry,
     * later ones are recorded as their own undoable step.
     */
    public void setBlocks(Collection<Candidate> candidates) {
        requireImage();
        if (state == EditState.DRAGGING) abortDrag();
        if (state == EditState.DRAWING) finishStroke();

        registry.clear();
        int skipped = 0;
        if (candidates != null) {
            for (Candidate c : candidates) {
                Rectangle r = base.clip(c.getBounds());
                if (r.isEmpty()) {
                    skipped++;
                    continue;
                }
                registry.add(r, c.getType(), c.getColor(), canvas.capture(r));
            }
        }
        if (skipped > 0) logger.warn("Skipped {} detected blocks outside the image", skipped);

        if (history.size() == 1) {
            history.replaceCurrent("detect", canvas, registry.all());
        } else {
            history.record("detect", canvas, registry.all());
        }
        fireChanged();
    }

    /**
     * While locked (detection running) pointer events and undo/redo are ignored.
     * Locking mid-gesture cancels a drag and commits a stroke.
     */
    public void setInputLocked(boolean locked) {
        if (locked && canvas != null) {
            if (state == EditState.DRAGGING) abortDrag();
            if (state == EditState.DRAWING) finishStroke();
        }
        this.inputLocked = locked;
        if (locked) hoveredId = null;
        fireChanged();
    }

    public boolean isInputLocked() { return inputLocked; }

    // ==========================================================
    // Tools
    // ==========================================================

    public void selectTool(EditTool t) {
        EditTool next = (t == null) ? EditTool.DRAW : t;
        if (state == EditState.DRAGGING) abortDrag();
        if (state == EditState.DRAWING) finishStroke();
        this.tool = next;
        this.hoveredId = null;
        this.state = EditState.IDLE;
        fireChanged();
    }

    public void setColor(Color c) {
        if (c != null) this.color = c;
    }

    public void setBrushSize(int size) {
        this.brushSize = Math.max(1, size);
    }

    // ==========================================================
    // Pointer events
    // ==========================================================

    public void pointerDown(Point p) {
        if (canvas == null || p == null || inputLocked) return;
        if (state == EditState.DRAGGING || state == EditState.DRAWING) return;

        switch (tool) {
            case MOVE:
                beginDrag(p);
                break;
            case DRAW:
            case ERASE:
                beginStroke(p);
                break;
            case ADD_BLOCK:
                stampBlock(p);
                break;
            default:
                break;
        }
    }

    public void pointerMove(Point p) {
        if (canvas == null || p == null || inputLocked) return;

        switch (state) {
            case DRAGGING:
                dragTo(p);
                break;
            case DRAWING:
                continueStroke(p);
                break;
            default:
                updateHover(p);
                break;
        }
    }

    public void pointerUp(Point p) {
        if (canvas == null || inputLocked) return;

        if (state == EditState.DRAGGING) {
            if (p != null) dragTo(p);
            drop();
        } else if (state == EditState.DRAWING) {
            if (p != null) continueStroke(p);
            finishStroke();
        }
    }

    // ==========================================================
    // Undo / redo
    // ==========================================================

    public boolean canUndo() { return isGestureFree() && history.canUndo(); }
    public boolean canRedo() { return isGestureFree() && history.canRedo(); }

    public boolean undo() {
        if (!canUndo()) return false;
        apply(history.undo());
        return true;
    }

    public boolean redo() {
        if (!canRedo()) return false;
        apply(history.redo());
        return true;
    }

    private void apply(CanvasHistory.Entry e) {
        canvas.copyFrom(e.getCanvas());
        registry.restore(e.getBlocks());
        hoveredId = null;
        state = EditState.IDLE;
        fireChanged();
    }

    // ==========================================================
    // Move tool
    // ==========================================================

    private void beginDrag(Point p) {
        Block b = registry.topmostAt(p);
        if (b == null) return;

        Rectangle r = b.getBounds();
        PixelPatch snap = canvas.capture(r);
        registry.updateSnapshot(b.getId(), snap);

        drag = new DragRecord(b.getId(), new Point(p.x - r.x, p.y - r.y), r, snap);
        CanvasCompositor.fillVacated(canvas, r);

        hoveredId = b.getId();
        state = EditState.DRAGGING;
        logger.debug("Picked up {} at {},{}", b.getId(), r.x, r.y);
        fireChanged();
    }

    private void dragTo(Point p) {
        Block b = registry.byId(drag.getBlockId());
        if (b == null) {
            logger.debug("Dragged block {} no longer exists; aborting drag", drag.getBlockId());
            abortDrag();
            return;
        }

        Rectangle prev = drag.getCurrent();
        Point off = drag.getGrabOffset();
        int nx = clamp(p.x - off.x, 0, canvas.getWidth() - prev.width);
        int ny = clamp(p.y - off.y, 0, canvas.getHeight() - prev.height);

        int t = params.dragMoveThreshold;
        if (Math.abs(nx - prev.x) < t && Math.abs(ny - prev.y) < t) return;

        Rectangle orig = drag.getOriginalBounds();
        if (!prev.equals(orig)) {
            CanvasCompositor.restoreFromBase(canvas, base, prev);
        }
        CanvasCompositor.fillVacated(canvas, orig);
        CanvasCompositor.paste(canvas, drag.getSnapshot(), nx, ny);

        Rectangle next = new Rectangle(nx, ny, prev.width, prev.height);
        drag.setCurrent(next);
        registry.updateBounds(b.getId(), next);
        fireChanged();
    }

    private void drop() {
        DragRecord d = drag;
        Block b = registry.byId(d.getBlockId());
        if (b == null) {
            logger.debug("Dropped block {} no longer exists; aborting drag", d.getBlockId());
            abortDrag();
            return;
        }

        Rectangle orig = d.getOriginalBounds();
        Rectangle at = d.getCurrent();
        Block covered = registry.firstOverlapping(at, b.getId());

        CanvasCompositor.restoreFromBase(canvas, base, orig);
        if (covered != null) {
            CanvasCompositor.restoreFromBase(canvas, base, covered.getBounds());
        }
        CanvasCompositor.paste(canvas, d.getSnapshot(), at.x, at.y);

        registry.updateBounds(b.getId(), at);
        if (d.hasLeftOrigin()) registry.markMoved(b.getId(), orig);
        if (covered != null) {
            registry.remove(covered.getId());
            logger.debug("{} dropped onto {}; {} removed", b.getId(), covered.getId(), covered.getId());
        }

        drag = null;
        state = EditState.HOVERING;
        hoveredId = b.getId();

        if (d.hasLeftOrigin() || covered != null) {
            history.record("move " + b.getId(), canvas, registry.all());
        }
        fireChanged();
    }

    /** Puts the canvas and registry back to the last recorded entry and forgets the drag. */
    private void abortDrag() {
        CanvasHistory.Entry e = history.current();
        if (e != null) {
            canvas.copyFrom(e.getCanvas());
            registry.restore(e.getBlocks());
        }
        drag = null;
        hoveredId = null;
        state = EditState.IDLE;
        fireChanged();
    }

    private void updateHover(Point p) {
        if (tool != EditTool.MOVE) {
            hoveredId = null;
            state = EditState.IDLE;
            return;
        }
        Block b = registry.topmostAt(p);
        String id = (b == null) ? null : b.getId();
        boolean changed = (id == null) ? hoveredId != null : !id.equals(hoveredId);
        hoveredId = id;
        state = (id == null) ? EditState.IDLE : EditState.HOVERING;
        if (changed) fireChanged();
    }

    // ==========================================================
    // Brush tools
    // ==========================================================

    private void beginStroke(Point p) {
        stroke = new BrushStroke(color, brushSize, tool == EditTool.ERASE, p);
        CanvasCompositor.strokeSegment(canvas, p, p, color, brushSize, stroke.isErase());
        state = EditState.DRAWING;
        fireChanged();
    }

    private void continueStroke(Point p) {
        Point last = stroke.last();
        if (last.equals(p)) return;
        CanvasCompositor.strokeSegment(canvas, last, p, stroke.getColor(), stroke.getWidth(), stroke.isErase());
        stroke.add(p);
        fireChanged();
    }

    private void finishStroke() {
        String label = stroke.isErase() ? "erase" : "draw";
        stroke = null;
        state = EditState.IDLE;
        history.record(label, canvas, registry.all());
        fireChanged();
    }

    // ==========================================================
    // Add block
    // ==========================================================

    private void stampBlock(Point p) {
        int w = Math.min(params.addBlockSize, canvas.getWidth());
        int h = Math.min(params.addBlockSize, canvas.getHeight());
        int x = clamp(p.x - w / 2, 0, canvas.getWidth() - w);
        int y = clamp(p.y - h / 2, 0, canvas.getHeight() - h);
        Rectangle r = new Rectangle(x, y, w, h);

        CanvasCompositor.fillSolid(canvas, r, color);
        Block b = registry.add(r, ZoneType.CUSTOM, color, canvas.capture(r));
        history.record("add " + b.getId(), canvas, registry.all());
        logger.debug("Stamped {} at {},{}", b.getId(), x, y);
        fireChanged();
    }

    // ==========================================================
    // Accessors
    // ==========================================================

    public boolean hasImage() { return canvas != null; }

    /** Working canvas; live, do not write through it. */
    public PixelBuffer getCanvas() { return canvas; }
    public BlockRegistry getRegistry() { return registry; }

    public EditTool getTool() { return tool; }
    public EditState getState() { return state; }
    public Color getColor() { return color; }
    public int getBrushSize() { return brushSize; }
    public String getHoveredBlockId() { return hoveredId; }
    public CanvasHistory getHistory() { return history; }

    public String getDraggedBlockId() {
        return drag == null ? null : drag.getBlockId();
    }

    /** Where the held block currently sits, for the display outline; null when not dragging. */
    public Rectangle getDragBounds() {
        return drag == null ? null : drag.getCurrent();
    }

    public List<Block> getBlocks() {
        return registry == null ? List.of() : registry.all();
    }

    public void setOnChanged(Runnable r) { this.onChanged = r; }

    // ==========================================================
    // Helpers
    // ==========================================================

    private boolean isGestureFree() {
        return !inputLocked && state != EditState.DRAGGING && state != EditState.DRAWING;
    }

    private void resetGesture() {
        inputLocked = false;
        drag = null;
        stroke = null;
        hoveredId = null;
        state = EditState.IDLE;
    }

    private void requireImage() {
        if (canvas == null) throw new IllegalStateException("No image loaded.");
    }

    private void fireChanged() {
        if (onChanged != null) onChanged.run();
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
