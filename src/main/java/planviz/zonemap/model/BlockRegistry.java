package planviz.zonemap.model;

import java.awt.Color;
import java.awt.Point;
import java.awt.Rectangle;
import java.util.*;

/**
 * Live, ordered collection of blocks for the current image, keyed by id.
 * Later blocks sit on top of earlier ones for hit testing.
 * <p>
 * Every mutation checks that the block rectangle stays inside the image and that ids are unique.
 */
public class BlockRegistry {

    private final int width;
    private final int height;
    private final LinkedHashMap<String, Block> byId = new LinkedHashMap<>();
    private int nextSeq = 1;

    public BlockRegistry(int width, int height) {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("Invalid registry size.");
        this.width = width;
        this.height = height;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    // ==========================================================
    // Mutations
    // ==========================================================

    /** Registers a new block under a generated id ("B1", "B2", ...). */
    public Block add(Rectangle bounds, ZoneType type, Color color, PixelPatch snapshot) {
        String id;
        do {
            id = "B" + (nextSeq++);
        } while (byId.containsKey(id));
        return add(id, bounds, type, color, snapshot);
    }

    public Block add(String id, Rectangle bounds, ZoneType type, Color color, PixelPatch snapshot) {
        if (id == null || id.trim().isEmpty()) throw new IllegalArgumentException("Block id is blank.");
        if (type == null) throw new IllegalArgumentException("Block type is null.");
        if (byId.containsKey(id)) throw new IllegalStateException("Duplicate block id: " + id);
        checkBounds(bounds);
        checkSnapshot(snapshot, bounds);

        Block b = new Block(id, type, color, bounds);
        b.setSnapshot(snapshot);
        byId.put(id, b);
        return b;
    }

    public void updateBounds(String id, Rectangle bounds) {
        Block b = require(id);
        checkBounds(bounds);
        if (bounds.width != b.getBounds().width || bounds.height != b.getBounds().height) {
            throw new IllegalArgumentException("Blocks move but never resize: " + id);
        }
        b.setBounds(bounds);
    }

    public void updateSnapshot(String id, PixelPatch snapshot) {
        Block b = require(id);
        checkSnapshot(snapshot, b.getBounds());
        b.setSnapshot(snapshot);
    }

    /** Flags the block as moved; the first recorded original position is kept. */
    public void markMoved(String id, Rectangle originalBounds) {
        Block b = require(id);
        checkBounds(originalBounds);
        b.markMoved(originalBounds);
    }

    public Block remove(String id) {
        if (id == null) return null;
        return byId.remove(id);
    }

    public void clear() {
        byId.clear();
    }

    /** Replaces the whole content with copies of {@code blocks} (used by undo/redo). */
    public void restore(Collection<Block> blocks) {
        byId.clear();
        if (blocks == null) return;
        for (Block b : blocks) {
            checkBounds(b.getBounds());
            if (byId.put(b.getId(), b.copy()) != null) {
                throw new IllegalStateException("Duplicate block id: " + b.getId());
            }
        }
    }

    // ==========================================================
    // Queries
    // ==========================================================

    public Block byId(String id) {
        if (id == null) return null;
        return byId.get(id.trim());
    }

    public boolean contains(String id) {
        return byId(id) != null;
    }

    public int size() { return byId.size(); }

    public boolean isEmpty() { return byId.isEmpty(); }

    /** Read-only view in insertion order. */
    public List<Block> all() {
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    /** Topmost (most recently added) block under the point, or null. */
    public Block topmostAt(Point p) {
        if (p == null) return null;
        List<Block> list = new ArrayList<>(byId.values());
        for (int i = list.size() - 1; i >= 0; i--) {
            if (list.get(i).containsPoint(p)) return list.get(i);
        }
        return null;
    }

    /** First block (in order) whose rectangle overlaps {@code r}, skipping {@code excludeId}. */
    public Block firstOverlapping(Rectangle r, String excludeId) {
        if (r == null) return null;
        for (Block b : byId.values()) {
            if (b.getId().equals(excludeId)) continue;
            if (b.getBounds().intersects(r)) return b;
        }
        return null;
    }

    public Map<ZoneType, Integer> countByType() {
        EnumMap<ZoneType, Integer> out = new EnumMap<>(ZoneType.class);
        for (Block b : byId.values()) out.merge(b.getType(), 1, Integer::sum);
        return out;
    }

    // ==========================================================
    // Invariants
    // ==========================================================

    private Block require(String id) {
        Block b = byId(id);
        if (b == null) throw new IllegalArgumentException("Unknown block id: " + id);
        return b;
    }

    private void checkBounds(Rectangle r) {
        if (r == null) throw new IllegalArgumentException("Block bounds are null.");
        if (r.width <= 0 || r.height <= 0) throw new IllegalArgumentException("Block bounds are empty: " + r);
        if (r.x < 0 || r.y < 0 || r.x + r.width > width || r.y + r.height > height) {
            throw new IllegalArgumentException("Block bounds outside image " + width + "x" + height + ": " + r);
        }
    }

    private static void checkSnapshot(PixelPatch p, Rectangle bounds) {
        if (p == null) return;
        if (p.getWidth() != bounds.width || p.getHeight() != bounds.height) {
            throw new IllegalArgumentException("Snapshot size does not match block bounds.");
        }
    }
}
