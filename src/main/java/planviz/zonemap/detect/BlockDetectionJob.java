package planviz.zonemap.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.model.PixelBuffer;
import planviz.zonemap.model.ZoneType;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Block detection over one image, split into row chunks so a UI timer can interleave it with
 * painting. Each {@link #processNextChunk()} scans up to {@code chunkRows} analysis rows.
 * <p>
 * Not thread-safe: drive it from a single thread (the Swing EDT in the editor).
 */
public class BlockDetectionJob {

    private static final Logger logger = LoggerFactory.getLogger(BlockDetectionJob.class);

    public enum Status { PENDING, RUNNING, DONE, CANCELLED, FAILED }

    private final DetectionParams params;
    private final int originalWidth;
    private final int originalHeight;
    private final double scale;
    private final PixelBuffer work;

    private final RegionScanner scanner;
    private final BoundaryInferencer inferencer;
    private final DedupResolver resolver;

    private volatile boolean cancelRequested;
    private Status status = Status.PENDING;
    private int nextY;
    private int seedsTried;

    public BlockDetectionJob(PixelBuffer source, ZonePalette palette, DetectionParams params) {
        if (source == null) throw new IllegalArgumentException("source is null");
        this.params = (params == null) ? new DetectionParams() : params;
        this.originalWidth = source.getWidth();
        this.originalHeight = source.getHeight();

        int max = this.params.maxDimension;
        if (originalWidth > max || originalHeight > max) {
            this.scale = Math.min((double) max / originalWidth, (double) max / originalHeight);
            int ww = Math.max(1, (int) Math.floor(originalWidth * scale));
            int wh = Math.max(1, (int) Math.floor(originalHeight * scale));
            this.work = source.scaledCopy(ww, wh);
        } else {
            this.scale = 1.0;
            this.work = source.copy();
        }

        this.scanner = new RegionScanner(work, palette == null ? ZonePalette.defaults() : palette, this.params, scale);
        this.inferencer = new BoundaryInferencer(this.params);
        this.resolver = new DedupResolver(this.params, scanner.getMinBlockSize(), scale, originalWidth, originalHeight);

        logger.debug("Detection settings: work={}x{}, stride={}, minSize={}, scale={}",
                work.getWidth(), work.getHeight(), scanner.getStride(), scanner.getMinBlockSize(),
                String.format("%.2f", scale));
    }

    // ==========================================================
    // Chunked sequence
    // ==========================================================

    public boolean hasNextChunk() {
        if (cancelRequested && (status == Status.PENDING || status == Status.RUNNING)) {
            status = Status.CANCELLED;
            logger.info("Block detection cancelled at row {} ({} blocks so far)", nextY, resolver.getAccepted().size());
        }
        return status == Status.PENDING || status == Status.RUNNING;
    }

    /**
     * Scans the next chunk.
     *
     * @return true if more chunks remain
     */
    public boolean processNextChunk() {
        if (!hasNextChunk()) return false;
        status = Status.RUNNING;

        int from = nextY;
        try {
            nextY = scanner.scanRows(nextY, nextY + params.chunkRows, this::handleSeed);
        } catch (RuntimeException ex) {
            status = Status.FAILED;
            logger.error("Block detection failed in rows {}..{}; keeping {} blocks",
                    from, from + params.chunkRows, resolver.getAccepted().size(), ex);
            return false;
        }
        logger.debug("Scanned rows {}..{} ({} blocks)", from, nextY, resolver.getAccepted().size());

        if (nextY >= scanner.rowLimit()) {
            status = Status.DONE;
            logSummary();
            return false;
        }
        return true;
    }

    /** Runs every remaining chunk on the calling thread. */
    public List<Candidate> runToCompletion() {
        while (processNextChunk()) {
            // keep going
        }
        return getCandidates();
    }

    /** Forgets all progress; the next chunk starts from the top. */
    public void restart() {
        cancelRequested = false;
        status = Status.PENDING;
        nextY = 0;
        seedsTried = 0;
        scanner.clearVisited();
        resolver.clear();
    }

    /** Safe to call from any thread; observed before the next chunk. */
    public void cancel() {
        cancelRequested = true;
    }

    // ==========================================================
    // Results
    // ==========================================================

    public Status getStatus() { return status; }
    public boolean isCancelled() { return status == Status.CANCELLED; }
    public boolean isFinished() { return status == Status.DONE; }

    public List<Candidate> getCandidates() {
        return new ArrayList<>(resolver.getAccepted());
    }

    public double getScale() { return scale; }
    public int getStride() { return scanner.getStride(); }
    public int getMinBlockSize() { return scanner.getMinBlockSize(); }
    public int getSeedsTried() { return seedsTried; }

    /** Fraction of analysis rows scanned, 0..1. */
    public double progress() {
        int limit = scanner.rowLimit();
        if (limit <= 0 || status == Status.DONE) return 1.0;
        return Math.min(1.0, Math.max(0.0, (double) nextY / limit));
    }

    public Map<ZoneType, Integer> countByType() {
        EnumMap<ZoneType, Integer> out = new EnumMap<>(ZoneType.class);
        for (Candidate c : resolver.getAccepted()) out.merge(c.getType(), 1, Integer::sum);
        return out;
    }

    // ==========================================================
    // Internals
    // ==========================================================

    private void handleSeed(ScanSeed seed) {
        seedsTried++;
        Rectangle r = inferencer.infer(work, seed);
        if (r == null) return;

        DedupResolver.Outcome outcome = resolver.offer(r, seed.getEntry().getType(), seed.getMatchedColor());
        if (outcome == DedupResolver.Outcome.ACCEPTED || outcome == DedupResolver.Outcome.REPLACED) {
            scanner.markVisited(r, params.visitStepFor(scanner.getStride()));
        }
    }

    private void logSummary() {
        List<Candidate> all = resolver.getAccepted();
        Map<ZoneType, Integer> byType = countByType();
        logger.info("Detected {} blocks in {}x{} image: {}", all.size(), originalWidth, originalHeight, byType);

        if (all.isEmpty()) {
            logger.warn("No colored blocks detected; the image may not contain zoning colors");
            return;
        }

        int commercial = byType.getOrDefault(ZoneType.COMMERCIAL, 0);
        int parks = byType.getOrDefault(ZoneType.PARK, 0) + byType.getOrDefault(ZoneType.GREEN_SPACE, 0);
        int amenities = 0;
        for (Map.Entry<ZoneType, Integer> e : byType.entrySet()) {
            if (e.getKey().isOverlay()) amenities += e.getValue();
        }

        if (commercial == 0) logger.warn("No commercial blocks detected");
        if (parks == 0) logger.warn("No park blocks detected");
        if (amenities == 0) logger.warn("No amenity blocks detected");
        if (byType.getOrDefault(ZoneType.RESIDENTIAL, 0) == all.size()) {
            logger.warn("Only residential blocks detected");
        }
    }
}
