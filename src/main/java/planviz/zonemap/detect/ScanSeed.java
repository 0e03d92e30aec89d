package planviz.zonemap.detect;

import java.awt.Color;

/** A scan-grid pixel (analysis coordinates) that matched a palette entry. */
public final class ScanSeed {

    private final int x;
    private final int y;
    private final PaletteEntry entry;
    private final Color matchedColor;
    private final double distance;

    public ScanSeed(int x, int y, PaletteEntry entry, Color matchedColor, double distance) {
        this.x = x;
        this.y = y;
        this.entry = entry;
        this.matchedColor = matchedColor;
        this.distance = distance;
    }

    public int getX() { return x; }
    public int getY() { return y; }
    public PaletteEntry getEntry() { return entry; }
    public Color getMatchedColor() { return matchedColor; }
    public double getDistance() { return distance; }

    @Override
    public String toString() {
        return "ScanSeed{" + x + "," + y + " " + entry.getType() + "}";
    }
}
