package planviz.zonemap.detect;

import planviz.zonemap.model.PixelBuffer;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Walks a coarse grid over the analysis buffer and reports pixels that match the palette.
 * Grid cells covered by accepted blocks are marked visited and skipped afterwards.
 */
public class RegionScanner {

    private final PixelBuffer work;
    private final ZonePalette palette;
    private final DetectionParams params;

    private final int stride;
    private final int minBlockSize;
    private final int cellsX;
    private final int cellsY;
    private final boolean[] visited;

    public RegionScanner(PixelBuffer work, ZonePalette palette, DetectionParams params, double scale) {
        if (work == null) throw new IllegalArgumentException("work buffer is null");
        if (palette == null) throw new IllegalArgumentException("palette is null");
        this.work = work;
        this.palette = palette;
        this.params = (params == null) ? new DetectionParams() : params;

        this.stride = this.params.strideFor(work.getWidth());
        this.minBlockSize = this.params.minBlockSizeFor(scale);
        this.cellsX = work.getWidth() / stride + 1;
        this.cellsY = work.getHeight() / stride + 1;
        this.visited = new boolean[cellsX * cellsY];
    }

    public int getStride() { return stride; }
    public int getMinBlockSize() { return minBlockSize; }

    /** Exclusive upper bound on scanned rows. */
    public int rowLimit() { return work.getHeight() - minBlockSize; }

    /** Exclusive upper bound on scanned columns. */
    public int columnLimit() { return work.getWidth() - minBlockSize; }

    public boolean isVisited(int x, int y) {
        int cx = x / stride;
        int cy = y / stride;
        if (cx < 0 || cy < 0 || cx >= cellsX || cy >= cellsY) return false;
        return visited[cy * cellsX + cx];
    }

    /** Marks the cells under {@code r} (analysis coordinates), sampling every {@code step} pixels. */
    public void markVisited(Rectangle r, int step) {
        int s = Math.max(1, step);
        int maxY = Math.min(r.y + r.height, work.getHeight());
        int maxX = Math.min(r.x + r.width, work.getWidth());
        for (int y = Math.max(0, r.y); y < maxY; y += s) {
            for (int x = Math.max(0, r.x); x < maxX; x += s) {
                visited[(y / stride) * cellsX + (x / stride)] = true;
            }
        }
    }

    public void clearVisited() {
        Arrays.fill(visited, false);
    }

    /**
     * Classifies one grid pixel. Null when it is transparent, background, outline,
     * already covered, or matches no palette color.
     */
    public ScanSeed seedAt(int x, int y) {
        if (isVisited(x, y)) return null;

        int argb = work.getArgb(x, y);
        int a = (argb >>> 24) & 0xFF;
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;

        if (a < params.scanMinAlpha) return null;
        if (ColorMatcher.isNearWhite(r, g, b)) return null;
        if (ColorMatcher.isNearBlack(r, g, b)) return null;

        ZonePalette.Match m = palette.closest(r, g, b);
        if (m == null) return null;
        return new ScanSeed(x, y, m.getEntry(), m.getColor(), m.getDistance());
    }

    /**
     * Scans grid rows starting at {@code fromY} while {@code y < toY} (and inside the row limit).
     * The visited set is re-checked per pixel, so a consumer that marks cells affects the rest
     * of the same pass.
     *
     * @return the first grid row not scanned
     */
    public int scanRows(int fromY, int toY, Consumer<ScanSeed> sink) {
        int end = Math.min(toY, rowLimit());
        int colEnd = columnLimit();
        int y = fromY;
        for (; y < end; y += stride) {
            for (int x = 0; x < colEnd; x += stride) {
                ScanSeed s = seedAt(x, y);
                if (s != null) sink.accept(s);
            }
        }
        return y;
    }
}
