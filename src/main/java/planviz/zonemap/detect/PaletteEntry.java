package planviz.zonemap.detect;

import planviz.zonemap.model.ZoneType;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One zone type with its reference colors and match tolerance (redmean units).
 */
public final class PaletteEntry {

    private final ZoneType type;
    private final List<Color> colors;
    private final double tolerance;

    public PaletteEntry(ZoneType type, List<Color> colors, double tolerance) {
        if (type == null) throw new IllegalArgumentException("type is null");
        if (colors == null || colors.isEmpty()) throw new IllegalArgumentException("No reference colors for " + type);
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite value >= 0 (" + type + ": " + tolerance + ")");
        }
        this.type = type;
        this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
        this.tolerance = tolerance;
    }

    public static PaletteEntry of(ZoneType type, double tolerance, int[]... rgb) {
        List<Color> cs = new ArrayList<>(rgb.length);
        for (int[] c : rgb) cs.add(new Color(c[0], c[1], c[2]));
        return new PaletteEntry(type, cs, tolerance);
    }

    public ZoneType getType() { return type; }
    public List<Color> getColors() { return colors; }
    public double getTolerance() { return tolerance; }

    public PaletteEntry withTolerance(double t) {
        return new PaletteEntry(type, colors, t);
    }

    @Override
    public String toString() {
        return type.getLabel() + " (" + colors.size() + " colors, tol " + tolerance + ")";
    }
}
