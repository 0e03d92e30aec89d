package planviz.zonemap.detect;

/**
 * Tuning knobs for block detection and editing. Defaults were tuned by eye on the generated
 * zoning renders; recalibrate the overlap/size factors against real imagery before relying on them.
 */
public class DetectionParams {

    // --- analysis buffer ---
    /** Longer side of the analysis copy; larger images are downsampled. */
    public int maxDimension = 1500;

    // --- scan grid ---
    public int minStride = 8;
    /** stride = max(minStride, workWidth / strideDivisor) */
    public int strideDivisor = 300;
    /** Work rows handled per chunk before yielding. */
    public int chunkRows = 100;

    // --- pixel classes ---
    public int scanMinAlpha = 128;
    public int boundaryMinAlpha = 100;

    // --- boundary walk ---
    public double seedToleranceFactor = 1.5;
    public double boundaryToleranceFactor = 2.0;
    /** Rows sampled on each side of the seed row while walking left/right. */
    public int sampleHalfSpan = 10;
    public int sampleStepVertical = 2;
    public int sampleStepHorizontal = 5;

    // --- minimum sizes ---
    public int minBlockSizeFloor = 40;
    /** Scaled by the downsample factor. */
    public int minBlockSizeBase = 60;
    public int overlayMinSizeFloor = 20;
    public double overlayMinSizeFactor = 0.5;
    public double areaMinAreaFactor = 0.8;
    public double overlayMinAreaFactor = 0.5;

    // --- dedup ---
    public double crossTypeOverlap = 0.6;
    public double sameTypeOverlap = 0.5;
    public double sameCenterFactor = 0.3;
    public double replaceAreaFactor = 1.2;
    public double visitStepFactor = 1.5;

    // --- editing ---
    public int addBlockSize = 100;
    /** Drag frames moving less than this on both axes are skipped. */
    public int dragMoveThreshold = 2;

    public DetectionParams copy() {
        DetectionParams p = new DetectionParams();
        p.maxDimension = maxDimension;
        p.minStride = minStride;
        p.strideDivisor = strideDivisor;
        p.chunkRows = chunkRows;
        p.scanMinAlpha = scanMinAlpha;
        p.boundaryMinAlpha = boundaryMinAlpha;
        p.seedToleranceFactor = seedToleranceFactor;
        p.boundaryToleranceFactor = boundaryToleranceFactor;
        p.sampleHalfSpan = sampleHalfSpan;
        p.sampleStepVertical = sampleStepVertical;
        p.sampleStepHorizontal = sampleStepHorizontal;
        p.minBlockSizeFloor = minBlockSizeFloor;
        p.minBlockSizeBase = minBlockSizeBase;
        p.overlayMinSizeFloor = overlayMinSizeFloor;
        p.overlayMinSizeFactor = overlayMinSizeFactor;
        p.areaMinAreaFactor = areaMinAreaFactor;
        p.overlayMinAreaFactor = overlayMinAreaFactor;
        p.crossTypeOverlap = crossTypeOverlap;
        p.sameTypeOverlap = sameTypeOverlap;
        p.sameCenterFactor = sameCenterFactor;
        p.replaceAreaFactor = replaceAreaFactor;
        p.visitStepFactor = visitStepFactor;
        p.addBlockSize = addBlockSize;
        p.dragMoveThreshold = dragMoveThreshold;
        return p;
    }

    // =========================
    // Derived values
    // =========================

    public int strideFor(int workWidth) {
        return Math.max(minStride, workWidth / Math.max(1, strideDivisor));
    }

    public int minBlockSizeFor(double scale) {
        return Math.max(minBlockSizeFloor, (int) Math.floor(minBlockSizeBase * scale));
    }

    public int visitStepFor(int stride) {
        return Math.max(1, (int) Math.floor(stride * visitStepFactor));
    }
}
