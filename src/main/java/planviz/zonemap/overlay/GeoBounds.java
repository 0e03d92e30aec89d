package planviz.zonemap.overlay;

/** Longitude/latitude box. Only built from finite values with positive extent. */
public final class GeoBounds {

    private final double minLon;
    private final double maxLon;
    private final double minLat;
    private final double maxLat;

    public GeoBounds(double minLon, double maxLon, double minLat, double maxLat) {
        this.minLon = minLon;
        this.maxLon = maxLon;
        this.minLat = minLat;
        this.maxLat = maxLat;
    }

    public double getMinLon() { return minLon; }
    public double getMaxLon() { return maxLon; }
    public double getMinLat() { return minLat; }
    public double getMaxLat() { return maxLat; }

    public double lonRange() { return maxLon - minLon; }
    public double latRange() { return maxLat - minLat; }

    public boolean isUsable() {
        double lr = lonRange();
        double ar = latRange();
        return Double.isFinite(lr) && Double.isFinite(ar) && lr > 0 && ar > 0;
    }

    /** Accumulates a box over points; {@link #build()} returns null when nothing was added. */
    public static final class Builder {
        private double minLon = Double.POSITIVE_INFINITY;
        private double maxLon = Double.NEGATIVE_INFINITY;
        private double minLat = Double.POSITIVE_INFINITY;
        private double maxLat = Double.NEGATIVE_INFINITY;

        public Builder add(double lon, double lat) {
            if (!Double.isFinite(lon) || !Double.isFinite(lat)) return this;
            minLon = Math.min(minLon, lon);
            maxLon = Math.max(maxLon, lon);
            minLat = Math.min(minLat, lat);
            maxLat = Math.max(maxLat, lat);
            return this;
        }

        public GeoBounds build() {
            if (minLon == Double.POSITIVE_INFINITY) return null;
            return new GeoBounds(minLon, maxLon, minLat, maxLat);
        }
    }

    @Override
    public String toString() {
        return "GeoBounds[lon " + minLon + ".." + maxLon + ", lat " + minLat + ".." + maxLat + "]";
    }
}
