package planviz.zonemap.overlay;

import java.awt.geom.Point2D;

/**
 * Linear lon/lat to canvas mapping over the polygon box. Latitude grows upwards, canvas y downwards.
 * Inputs are clamped to the box and outputs to the canvas.
 */
public final class GeoTransform {

    private final GeoBounds bounds;
    private final int canvasWidth;
    private final int canvasHeight;

    private GeoTransform(GeoBounds bounds, int canvasWidth, int canvasHeight) {
        this.bounds = bounds;
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;
    }

    /**
     * @param bounds null or degenerate bounds give a fallback transform that places nothing
     */
    public static GeoTransform of(GeoBounds bounds, int canvasWidth, int canvasHeight) {
        GeoBounds b = (bounds != null && bounds.isUsable()) ? bounds : null;
        return new GeoTransform(b, canvasWidth, canvasHeight);
    }

    /** False for the full-canvas fallback (roads are not drawn). */
    public boolean hasGeoBounds() { return bounds != null; }

    public GeoBounds getBounds() { return bounds; }

    /** Canvas point, or null when there are no geo bounds or the input is not finite. */
    public Point2D.Double toCanvas(double lon, double lat) {
        if (bounds == null) return null;
        if (!Double.isFinite(lon) || !Double.isFinite(lat)) return null;

        double cl = Math.max(bounds.getMinLon(), Math.min(bounds.getMaxLon(), lon));
        double ca = Math.max(bounds.getMinLat(), Math.min(bounds.getMaxLat(), lat));

        double nx = (cl - bounds.getMinLon()) / bounds.lonRange();
        double ny = 1 - (ca - bounds.getMinLat()) / bounds.latRange();

        double x = Math.max(0, Math.min(canvasWidth, nx * canvasWidth));
        double y = Math.max(0, Math.min(canvasHeight, ny * canvasHeight));
        return new Point2D.Double(x, y);
    }
}
