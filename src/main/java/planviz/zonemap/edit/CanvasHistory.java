package planviz.zonemap.edit;

import planviz.zonemap.io.ImageExporter;
import planviz.zonemap.model.Block;
import planviz.zonemap.model.PixelBuffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Linear undo/redo over canvas snapshots (plus the block list at that moment).
 * Recording after an undo discards the redo tail; the oldest entries are dropped past the limit.
 * <p>
 * Canvases are held PNG-compressed and decoded when an entry is read back.
 */
public class CanvasHistory {

    public static final class Entry {
        private final String label;
        private final byte[] png;
        private final List<Block> blocks;

        Entry(String label, byte[] png, List<Block> blocks) {
            this.label = label;
            this.png = png;
            this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        }

        public String getLabel() { return label; }

        /** Fresh decode on every call. */
        public PixelBuffer getCanvas() {
            try {
                return PixelBuffer.fromImage(ImageExporter.fromPngBytes(png));
            } catch (IOException ex) {
                throw new UncheckedIOException("History entry '" + label + "' failed to decode", ex);
            }
        }

        public List<Block> getBlocks() { return blocks; }

        public int getEncodedSize() { return png.length; }
    }

    private final int limit;
    private final List<Entry> entries = new ArrayList<>();
    private int index = -1;

    public CanvasHistory(int limit) {
        if (limit < 1) throw new IllegalArgumentException("History limit must be >= 1");
        this.limit = limit;
    }

    /** Records {@code canvas} and copies of {@code blocks} as the new current entry. */
    public void record(String label, PixelBuffer canvas, List<Block> blocks) {
        Entry e = encode(label, canvas, blocks);

        while (entries.size() > index + 1) {
            entries.remove(entries.size() - 1);
        }
        entries.add(e);

        while (entries.size() > limit) {
            entries.remove(0);
        }
        index = entries.size() - 1;
    }

    /** Overwrites the current entry in place; records normally when the history is empty. */
    public void replaceCurrent(String label, PixelBuffer canvas, List<Block> blocks) {
        if (index < 0) {
            record(label, canvas, blocks);
            return;
        }
        entries.set(index, encode(label, canvas, blocks));
    }

    public boolean canUndo() { return index > 0; }
    public boolean canRedo() { return index >= 0 && index < entries.size() - 1; }

    /** Steps back one entry. @return the entry now current, or null if there is nothing to undo */
    public Entry undo() {
        if (!canUndo()) return null;
        index--;
        return entries.get(index);
    }

    public Entry redo() {
        if (!canRedo()) return null;
        index++;
        return entries.get(index);
    }

    public Entry current() {
        return index < 0 ? null : entries.get(index);
    }

    public void clear() {
        entries.clear();
        index = -1;
    }

    public int size() { return entries.size(); }

    /** Current position, or -1 when empty. */
    public int getIndex() { return index; }

    public int getLimit() { return limit; }

    /** Compressed canvas bytes held across all entries. */
    public long retainedBytes() {
        long total = 0;
        for (Entry e : entries) total += e.getEncodedSize();
        return total;
    }

    private static Entry encode(String label, PixelBuffer canvas, List<Block> blocks) {
        if (canvas == null) throw new IllegalArgumentException("canvas is null");

        byte[] png;
        try {
            png = ImageExporter.toPngBytes(canvas.getImage());
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not encode canvas for history", ex);
        }

        List<Block> copies = new ArrayList<>();
        if (blocks != null) {
            for (Block b : blocks) copies.add(b.copy());
        }
        return new Entry(label, png, copies);
    }
}
